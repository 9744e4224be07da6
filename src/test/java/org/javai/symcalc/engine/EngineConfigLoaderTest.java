package org.javai.symcalc.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.logging.log4j.Level;
import org.javai.symcalc.testsupport.LogCapture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EngineConfigLoaderTest {

	private final EngineConfigLoader loader = new EngineConfigLoader();

	@Test
	void bundledDefaultsMatchBuiltIns() {
		try (LogCapture capture = LogCapture.of(EngineConfigLoader.class, Level.INFO)) {
			EngineConfig config = loader.loadDefaults();

			assertThat(config).isEqualTo(EngineConfig.defaults());
			assertThat(capture.messagesAt(Level.INFO))
					.anyMatch(message -> message.contains(EngineConfigLoader.DEFAULT_RESOURCE));
		}
	}

	@Nested
	@DisplayName("reading YAML")
	class Reading {

		@Test
		void allKeys() {
			EngineConfig config = loader.loadString("""
					symcalc:
					  default-variable: t
					  parser:
					    max-nesting-depth: 32
					  display:
					    significant-digits: 4
					""");

			assertThat(config).isEqualTo(new EngineConfig("t", 32, 4));
		}

		@Test
		void missingKeysFallBackToDefaults() {
			EngineConfig config = loader.loadString("""
					symcalc:
					  display:
					    significant-digits: 10
					""");

			assertThat(config.defaultVariable()).isEqualTo("x");
			assertThat(config.maxNestingDepth()).isEqualTo(256);
			assertThat(config.significantDigits()).isEqualTo(10);
		}

		@Test
		void emptyDocumentGivesDefaults() {
			assertThat(loader.loadString("")).isEqualTo(EngineConfig.defaults());
		}

		@Test
		void numbersAsStrings() {
			EngineConfig config = loader.loadString("""
					symcalc:
					  parser:
					    max-nesting-depth: "64"
					""");

			assertThat(config.maxNestingDepth()).isEqualTo(64);
		}

		@Test
		void fromStream() {
			String yaml = "symcalc:\n  default-variable: z\n";

			EngineConfig config = loader.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));

			assertThat(config.defaultVariable()).isEqualTo("z");
		}

		@Test
		void fromFile(@TempDir Path dir) throws Exception {
			Path file = dir.resolve("engine.yml");
			Files.writeString(file, "symcalc:\n  parser:\n    max-nesting-depth: 8\n");

			assertThat(loader.load(file).maxNestingDepth()).isEqualTo(8);
		}
	}

	@Nested
	@DisplayName("invalid configuration")
	class Invalid {

		@Test
		void nonIntegerValue() {
			assertThatThrownBy(() -> loader.loadString("symcalc:\n  display:\n    significant-digits: many\n"))
					.isInstanceOf(EngineConfigException.class)
					.hasMessage("'significant-digits' must be an integer, got: many");
		}

		@Test
		void sectionIsNotAMapping() {
			assertThatThrownBy(() -> loader.loadString("symcalc:\n  parser: 12\n"))
					.isInstanceOf(EngineConfigException.class)
					.hasMessageContaining("'symcalc.parser' must be a mapping");
		}

		@Test
		void outOfRangeValue() {
			assertThatThrownBy(() -> loader.loadString("symcalc:\n  display:\n    significant-digits: 30\n"))
					.isInstanceOf(EngineConfigException.class)
					.hasMessageContaining("significant-digits must be between 1 and 17");
		}

		@Test
		void variableMustBeIdentifier() {
			assertThatThrownBy(() -> loader.loadString("symcalc:\n  default-variable: 2x\n"))
					.isInstanceOf(EngineConfigException.class)
					.hasMessageContaining("must be an identifier");
		}

		@Test
		void malformedYaml() {
			assertThatThrownBy(() -> loader.loadString("symcalc: [unclosed"))
					.isInstanceOf(EngineConfigException.class)
					.hasMessage("Failed to read engine configuration from string")
					.hasCauseInstanceOf(Exception.class);
		}

		@Test
		void missingFile(@TempDir Path dir) {
			Path missing = dir.resolve("absent.yml");

			assertThatThrownBy(() -> loader.load(missing))
					.isInstanceOf(EngineConfigException.class)
					.hasMessageContaining("absent.yml");
		}
	}
}
