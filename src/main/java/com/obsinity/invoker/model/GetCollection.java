package com.obsinity.invoker.model;

import lombok.experimental.SuperBuilder;

/** Read operation returning a collection of resources. */
@SuperBuilder
public class GetCollection extends Operation {

	@Override
	public String getMethod() {
		return "GET";
	}

	@Override
	public boolean isCollection() {
		return true;
	}
}
