package com.obsinity.invoker.model;

import lombok.experimental.SuperBuilder;

@SuperBuilder
public class Put extends Operation {

	@Override
	public String getMethod() {
		return "PUT";
	}
}
