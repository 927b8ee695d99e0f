package com.obsinity.invoker.model;

import lombok.experimental.SuperBuilder;

@SuperBuilder
public class Post extends Operation {

	@Override
	public String getMethod() {
		return "POST";
	}
}
