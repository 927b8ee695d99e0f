package com.obsinity.invoker.model;

import lombok.experimental.SuperBuilder;

@SuperBuilder
public class Get extends Operation {

	@Override
	public String getMethod() {
		return "GET";
	}
}
