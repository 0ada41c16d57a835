package com.splittree.config;

import com.splittree.codec.LabelStyle;
import com.splittree.codec.SplitCodec;
import com.splittree.common.IEnvGetter;
import com.splittree.render.RenderFormat;
import com.splittree.tree.InconsistencyPolicy;
import com.splittree.tree.TreeBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Settings for parsing, building and rendering.
 * <p>
 * Defaults come from {@code splittree.properties} on the classpath; each key can be overridden by an
 * environment variable, e.g. {@code splittree.inconsistency.policy} by {@code SPLITTREE_INCONSISTENCY_POLICY}.
 */
public record SplitTreeConfig(char splitDelimiter,
                              LabelStyle labelStyle,
                              InconsistencyPolicy inconsistencyPolicy,
                              boolean checkLeafUniverse,
                              RenderFormat renderFormat) {
    private static final Logger log = LoggerFactory.getLogger(SplitTreeConfig.class);

    public static final String RESOURCE = "splittree.properties";

    public static final String SPLIT_DELIMITER = "splittree.split.delimiter";
    public static final String LABEL_STYLE = "splittree.label.style";
    public static final String INCONSISTENCY_POLICY = "splittree.inconsistency.policy";
    public static final String CHECK_LEAF_UNIVERSE = "splittree.check.leaf.universe";
    public static final String RENDER_FORMAT = "splittree.render.format";

    public SplitTreeConfig {
        Objects.requireNonNull(labelStyle, "labelStyle");
        Objects.requireNonNull(inconsistencyPolicy, "inconsistencyPolicy");
        Objects.requireNonNull(renderFormat, "renderFormat");
    }

    public static SplitTreeConfig defaults() {
        return new SplitTreeConfig(SplitCodec.DEFAULT_DELIMITER, LabelStyle.CHARACTER,
                InconsistencyPolicy.CONTINUE, true, RenderFormat.ASCII);
    }

    public static SplitTreeConfig load() {
        return load(IEnvGetter.env);
    }

    public static SplitTreeConfig load(IEnvGetter env) {
        return from(env.orElse(loadProperties()));
    }

    /** Reads every key from {@code source}, where keys are looked up in environment-variable form. */
    public static SplitTreeConfig from(IEnvGetter source) {
        IEnvGetter byKey = key -> source.get(envName(key));
        SplitTreeConfig d = defaults();
        SplitTreeConfig config = new SplitTreeConfig(
                IEnvGetter.getCharOr(byKey, SPLIT_DELIMITER, d.splitDelimiter()),
                IEnvGetter.getEnumOr(byKey, LABEL_STYLE, LabelStyle.class, d.labelStyle()),
                IEnvGetter.getEnumOr(byKey, INCONSISTENCY_POLICY, InconsistencyPolicy.class, d.inconsistencyPolicy()),
                IEnvGetter.getBooleanOr(byKey, CHECK_LEAF_UNIVERSE, d.checkLeafUniverse()),
                IEnvGetter.getEnumOr(byKey, RENDER_FORMAT, RenderFormat.class, d.renderFormat()));
        log.debug("Loaded {}", config);
        return config;
    }

    /** {@code splittree.split.delimiter} → {@code SPLITTREE_SPLIT_DELIMITER}. */
    public static String envName(String key) {
        return key.toUpperCase(Locale.ROOT).replace('.', '_');
    }

    /** Properties file contents keyed by environment-variable name. */
    static IEnvGetter loadProperties() {
        Properties props = new Properties();
        try (InputStream is = SplitTreeConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (is != null) props.load(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load " + RESOURCE, e);
        }
        Properties byEnvName = new Properties();
        for (String key : props.stringPropertyNames()) byEnvName.setProperty(envName(key), props.getProperty(key));
        return byEnvName::getProperty;
    }

    public SplitCodec splitCodec() {
        return new SplitCodec(splitDelimiter, labelStyle);
    }

    public TreeBuilder treeBuilder() {
        return new TreeBuilder(inconsistencyPolicy, checkLeafUniverse);
    }
}
