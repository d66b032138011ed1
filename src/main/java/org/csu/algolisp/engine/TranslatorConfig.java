package org.csu.algolisp.engine;

import lombok.Getter;
import lombok.Setter;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * @author hidyouth
 * @description: 翻译器配置
 * Defaults live in the fields; {@link #load()} overlays {@code translator.properties}
 * from the classpath when it exists.
 */
@Getter
@Setter
public class TranslatorConfig {

    public static final String RESOURCE = "translator.properties";

    public static final String SPLICE_STYLE = "translator.splice-style";
    public static final String CHAR_HEX_TERMINATOR_REQUIRED = "translator.char-hex-terminator-required";
    public static final String GUARD_POLICY = "translator.guard-policy";
    public static final String DEBUG = "translator.debug";

    private SpliceStyle spliceStyle = SpliceStyle.APPLY;
    private boolean charHexTerminatorRequired = false;
    private GuardPolicy guardPolicy = GuardPolicy.RERAISE;
    private boolean debug = false;

    public static TranslatorConfig defaults() {
        return new TranslatorConfig();
    }

    public static TranslatorConfig load() {
        TranslatorConfig config = new TranslatorConfig();
        try (InputStream in = TranslatorConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                return config;
            }
            Properties properties = new Properties();
            properties.load(in);
            config.apply(properties);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
        return config;
    }

    public static TranslatorConfig from(Properties properties) {
        TranslatorConfig config = new TranslatorConfig();
        config.apply(properties);
        return config;
    }

    /**
     * Overrides the keys present in {@code properties}; absent keys keep their current value.
     */
    public void apply(Properties properties) {
        String splice = properties.getProperty(SPLICE_STYLE);
        if (splice != null) {
            spliceStyle = SpliceStyle.fromText(splice);
        }
        String hexTerminator = properties.getProperty(CHAR_HEX_TERMINATOR_REQUIRED);
        if (hexTerminator != null) {
            charHexTerminatorRequired = Boolean.parseBoolean(hexTerminator.trim());
        }
        String guard = properties.getProperty(GUARD_POLICY);
        if (guard != null) {
            guardPolicy = GuardPolicy.fromText(guard);
        }
        String debugFlag = properties.getProperty(DEBUG);
        if (debugFlag != null) {
            debug = Boolean.parseBoolean(debugFlag.trim());
        }
    }

    @Override
    public String toString() {
        return String.format("TranslatorConfig[spliceStyle=%s, charHexTerminatorRequired=%s, guardPolicy=%s, debug=%s]",
                spliceStyle, charHexTerminatorRequired, guardPolicy, debug);
    }
}
