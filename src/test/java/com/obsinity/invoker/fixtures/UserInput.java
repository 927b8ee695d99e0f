package com.obsinity.invoker.fixtures;

public record UserInput(String name, String email) {}
