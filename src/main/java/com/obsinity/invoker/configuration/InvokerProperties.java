package com.obsinity.invoker.configuration;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@ConfigurationProperties(prefix = "obsinity.invoker")
public class InvokerProperties {

	/** Turns the whole auto-configuration off. */
	private boolean enabled = true;

	/** Bind untagged parameters to a URI variable of the same name. */
	private boolean magicMapping = true;

	/** Parameter names that receive the payload of a write call. */
	private List<String> payloadAliases = new ArrayList<>(List.of("data", "input"));

	/** Bean name of the host's {@code StateProcessor} to decorate. */
	private String processorBean = "stateProcessor";

	/** Bean name of the host's {@code StateProvider} to decorate. */
	private String providerBean = "stateProvider";
}
