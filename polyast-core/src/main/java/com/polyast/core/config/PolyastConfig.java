package com.polyast.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.polyast.core.lang.Language;

import java.util.Arrays;
import java.util.List;

/**
 * Root configuration for PolyAST.
 *
 * <p>Loaded from {@code polyast.yaml}. Controls which languages are processed, the
 * collaborator parser settings, the debug dump format, and the batch driver.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * languages:
 *   enabled: [java, javascript]
 *   java:
 *     languageLevel: JAVA_17
 *   javascript:
 *     languageVersion: 200
 *
 * dump:
 *   includeTokens: true
 *   abstractPositions: false
 *   pretty: true
 *
 * driver:
 *   timeoutSeconds: 30
 *   threads: 4
 * }</pre>
 *
 * @param languages language selection and parser settings
 * @param dump JSON dump settings
 * @param driver batch driver settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PolyastConfig(
    @JsonProperty("languages") LanguageSettings languages,
    @JsonProperty("dump") DumpSettings dump,
    @JsonProperty("driver") DriverSettings driver
) {

    public PolyastConfig {
        languages = languages != null ? languages : LanguageSettings.defaults();
        dump = dump != null ? dump : DumpSettings.defaults();
        driver = driver != null ? driver : DriverSettings.defaults();
    }

    /**
     * Creates a default configuration with every language enabled.
     *
     * @return default configuration
     */
    public static PolyastConfig defaults() {
        return new PolyastConfig(LanguageSettings.defaults(), DumpSettings.defaults(), DriverSettings.defaults());
    }

    /**
     * Language selection and parser settings.
     *
     * @param enabled enabled language ids; null or empty means all
     * @param java JavaParser settings
     * @param javascript Rhino settings
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LanguageSettings(
        @JsonProperty("enabled") List<String> enabled,
        @JsonProperty("java") JavaSettings java,
        @JsonProperty("javascript") JavaScriptSettings javascript
    ) {
        public LanguageSettings {
            enabled = enabled != null ? List.copyOf(enabled) : List.of();
            java = java != null ? java : JavaSettings.defaults();
            javascript = javascript != null ? javascript : JavaScriptSettings.defaults();
        }

        public static LanguageSettings defaults() {
            return new LanguageSettings(List.of(), JavaSettings.defaults(), JavaScriptSettings.defaults());
        }

        /**
         * Returns true when the language is listed, or when no language is listed.
         */
        public boolean isEnabled(Language language) {
            return enabled.isEmpty() || enabled.stream().anyMatch(id -> id.equalsIgnoreCase(language.id()));
        }

        public List<Language> enabledLanguages() {
            return Arrays.stream(Language.values()).filter(this::isEnabled).toList();
        }
    }

    /**
     * @param languageLevel JavaParser {@code LanguageLevel} constant name, e.g. {@code JAVA_17}
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record JavaSettings(@JsonProperty("languageLevel") String languageLevel) {
        public JavaSettings {
            languageLevel = languageLevel != null ? languageLevel : "JAVA_17";
        }

        public static JavaSettings defaults() {
            return new JavaSettings("JAVA_17");
        }
    }

    /**
     * @param languageVersion Rhino language version, e.g. {@code 200} for ES6 features
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record JavaScriptSettings(@JsonProperty("languageVersion") Integer languageVersion) {
        public JavaScriptSettings {
            languageVersion = languageVersion != null ? languageVersion : 200;
        }

        public static JavaScriptSettings defaults() {
            return new JavaScriptSettings(200);
        }
    }

    /**
     * @param includeTokens render token positions
     * @param abstractPositions erase positions before rendering
     * @param pretty indent the JSON output
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DumpSettings(
        @JsonProperty("includeTokens") Boolean includeTokens,
        @JsonProperty("abstractPositions") Boolean abstractPositions,
        @JsonProperty("pretty") Boolean pretty
    ) {
        public DumpSettings {
            includeTokens = includeTokens != null ? includeTokens : Boolean.TRUE;
            abstractPositions = abstractPositions != null ? abstractPositions : Boolean.FALSE;
            pretty = pretty != null ? pretty : Boolean.TRUE;
        }

        public static DumpSettings defaults() {
            return new DumpSettings(true, false, true);
        }
    }

    /**
     * @param timeoutSeconds wall-clock limit per file
     * @param threads worker threads of the batch driver
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DriverSettings(
        @JsonProperty("timeoutSeconds") Integer timeoutSeconds,
        @JsonProperty("threads") Integer threads
    ) {
        public DriverSettings {
            timeoutSeconds = timeoutSeconds != null && timeoutSeconds > 0 ? timeoutSeconds : 30;
            threads = threads != null && threads > 0 ? threads : 4;
        }

        public static DriverSettings defaults() {
            return new DriverSettings(30, 4);
        }
    }
}
