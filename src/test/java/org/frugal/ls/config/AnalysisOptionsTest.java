package org.frugal.ls.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class AnalysisOptionsTest {

    @Test
    void referenceConfigMatchesDefaults() {
        Config config = ConfigFactory.parseResources("reference.conf").resolve();

        assertThat(AnalysisOptions.fromConfig(config)).isEqualTo(AnalysisOptions.defaults());
    }

    @Test
    void readsOverriddenValues() {
        Config config = ConfigFactory.parseString("""
                frugal-ls {
                  analysis.file-extensions = [".frugal", ".thrift"]
                  diagnostics.naming-conventions = false
                }
                """).withFallback(ConfigFactory.parseResources("reference.conf")).resolve();

        AnalysisOptions options = AnalysisOptions.fromConfig(config);

        assertThat(options.fileExtensions()).containsExactly(".frugal", ".thrift");
        assertThat(options.namingConventions()).isFalse();
        assertThat(options.typeReferences()).isTrue();
    }

    @Test
    void rejectsEmptyExtensionList() {
        assertThatThrownBy(() -> new AnalysisOptions(List.of(), true, true))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void failsOnWrongType() {
        Config config = ConfigFactory.parseString("frugal-ls.diagnostics.type-references = maybe")
                .withFallback(ConfigFactory.parseResources("reference.conf")).resolve();

        assertThatThrownBy(() -> AnalysisOptions.fromConfig(config)).isInstanceOf(ConfigException.WrongType.class);
    }
}
