package com.obsinity.invoker.model;

import lombok.experimental.SuperBuilder;

@SuperBuilder
public class Patch extends Operation {

	@Override
	public String getMethod() {
		return "PATCH";
	}
}
