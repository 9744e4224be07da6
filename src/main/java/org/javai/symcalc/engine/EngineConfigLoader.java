package org.javai.symcalc.engine;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads {@link EngineConfig} from YAML.
 * <p>
 * Expected layout, every key optional:
 * <pre>
 * symcalc:
 *   default-variable: x
 *   parser:
 *     max-nesting-depth: 256
 *   display:
 *     significant-digits: 6
 * </pre>
 */
public class EngineConfigLoader {

	private static final Logger logger = LoggerFactory.getLogger(EngineConfigLoader.class);

	public static final String DEFAULT_RESOURCE = "META-INF/symcalc/engine-defaults.yml";

	private final Yaml yaml = new Yaml();

	/**
	 * Loads the configuration bundled on the classpath, falling back to
	 * {@link EngineConfig#defaults()} when the resource is absent.
	 */
	public EngineConfig loadDefaults() {
		ClassLoader classLoader = EngineConfigLoader.class.getClassLoader();
		try (InputStream stream = classLoader.getResourceAsStream(DEFAULT_RESOURCE)) {
			if (stream == null) {
				logger.warn("No {} on the classpath, using built-in defaults", DEFAULT_RESOURCE);
				return EngineConfig.defaults();
			}
			EngineConfig config = load(stream);
			logger.info("Loaded engine configuration from classpath:{}", DEFAULT_RESOURCE);
			return config;
		} catch (EngineConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new EngineConfigException("Failed to read engine configuration from classpath:" + DEFAULT_RESOURCE, e);
		}
	}

	public EngineConfig load(Path path) {
		try (Reader reader = Files.newBufferedReader(path)) {
			EngineConfig config = build(yaml.load(reader));
			logger.info("Loaded engine configuration from {}", path);
			return config;
		} catch (EngineConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new EngineConfigException("Failed to read engine configuration from path: " + path, e);
		}
	}

	public EngineConfig load(InputStream inputStream) {
		try {
			return build(yaml.load(inputStream));
		} catch (EngineConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new EngineConfigException("Failed to read engine configuration from input stream", e);
		}
	}

	public EngineConfig loadString(String yamlContent) {
		try {
			return build(yaml.load(yamlContent));
		} catch (EngineConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new EngineConfigException("Failed to read engine configuration from string", e);
		}
	}

	private EngineConfig build(Object document) {
		EngineConfig defaults = EngineConfig.defaults();
		if (document == null) {
			return defaults;
		}
		Map<String, Object> root = section(document, "document root");
		Map<String, Object> symcalc = section(root.get("symcalc"), "symcalc");
		Map<String, Object> parser = section(symcalc.get("parser"), "symcalc.parser");
		Map<String, Object> display = section(symcalc.get("display"), "symcalc.display");

		String defaultVariable = symcalc.containsKey("default-variable")
				? String.valueOf(symcalc.get("default-variable"))
				: defaults.defaultVariable();
		int maxNestingDepth = intValue(parser, "max-nesting-depth", defaults.maxNestingDepth());
		int significantDigits = intValue(display, "significant-digits", defaults.significantDigits());

		return new EngineConfig(defaultVariable, maxNestingDepth, significantDigits);
	}

	@SuppressWarnings("unchecked")
	private Map<String, Object> section(Object value, String name) {
		if (value == null) {
			return Map.of();
		}
		if (!(value instanceof Map)) {
			throw new EngineConfigException("'" + name + "' must be a mapping, got: " + value);
		}
		return (Map<String, Object>) value;
	}

	private int intValue(Map<String, Object> section, String key, int defaultValue) {
		Object value = section.get(key);
		if (value == null) {
			return defaultValue;
		}
		if (value instanceof Integer i) {
			return i;
		}
		try {
			return Integer.parseInt(value.toString().trim());
		} catch (NumberFormatException e) {
			throw new EngineConfigException("'" + key + "' must be an integer, got: " + value, e);
		}
	}
}
