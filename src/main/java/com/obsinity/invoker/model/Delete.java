package com.obsinity.invoker.model;

import lombok.experimental.SuperBuilder;

@SuperBuilder
public class Delete extends Operation {

	@Override
	public String getMethod() {
		return "DELETE";
	}
}
