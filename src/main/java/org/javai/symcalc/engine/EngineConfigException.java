package org.javai.symcalc.engine;

/**
 * Exception thrown when engine configuration cannot be read or holds invalid values.
 */
public class EngineConfigException extends RuntimeException {

	public EngineConfigException(String message) {
		super(message);
	}

	public EngineConfigException(String message, Throwable cause) {
		super(message, cause);
	}
}
