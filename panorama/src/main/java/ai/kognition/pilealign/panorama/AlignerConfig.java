/*
 * Copyright 2022 Jim Carroll
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.kognition.pilealign.panorama;

import java.io.IOException;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.pilealign.util.PropertiesUtils;

/**
 * The tunable parameters of a {@link PanoramaAligner}. Defaults come from the classpath resource
 * {@value #DEFAULTS_RESOURCE} and can be overridden by a properties file.
 */
public class AlignerConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(AlignerConfig.class);

    public static final String DEFAULTS_RESOURCE = "pilealign-defaults.properties";

    public final float harrisK;
    public final float harrisThreshold;
    public final double harrisSigma;
    public final int harrisSuppression;

    public final int correlationWindow;
    public final double correlationMaxDistance;

    public final double ransacThreshold;
    public final double ransacProbability;
    public final long ransacSeed;
    public final int ransacMaxEvaluations;

    private AlignerConfig(final Properties props) {
        final Properties harris = PropertiesUtils.getSection(props, "harris", true);
        harrisK = (float)PropertiesUtils.getDouble(harris, "k", 0.04);
        harrisThreshold = (float)PropertiesUtils.getDouble(harris, "threshold", 1000.0);
        harrisSigma = PropertiesUtils.getDouble(harris, "sigma", 1.4);
        harrisSuppression = PropertiesUtils.getInt(harris, "suppression", 3);

        final Properties correlation = PropertiesUtils.getSection(props, "correlation", true);
        correlationWindow = PropertiesUtils.getInt(correlation, "window", 9);
        correlationMaxDistance = PropertiesUtils.getDouble(correlation, "maxDistance", 0.0);

        final Properties ransac = PropertiesUtils.getSection(props, "ransac", true);
        ransacThreshold = PropertiesUtils.getDouble(ransac, "threshold", 0.001);
        ransacProbability = PropertiesUtils.getDouble(ransac, "probability", 0.99);
        ransacSeed = PropertiesUtils.getLong(ransac, "seed", 0L);
        ransacMaxEvaluations = PropertiesUtils.getInt(ransac, "maxEvaluations", 1000);
    }

    private AlignerConfig(final AlignerConfig other, final long seed) {
        harrisK = other.harrisK;
        harrisThreshold = other.harrisThreshold;
        harrisSigma = other.harrisSigma;
        harrisSuppression = other.harrisSuppression;
        correlationWindow = other.correlationWindow;
        correlationMaxDistance = other.correlationMaxDistance;
        ransacThreshold = other.ransacThreshold;
        ransacProbability = other.ransacProbability;
        ransacSeed = seed;
        ransacMaxEvaluations = other.ransacMaxEvaluations;
    }

    /**
     * The defaults with any keys in {@code overrides} replacing them.
     */
    public static AlignerConfig fromProperties(final Properties overrides) throws IOException {
        final Properties props = defaultProperties();
        props.putAll(overrides);
        return new AlignerConfig(props);
    }

    public static AlignerConfig defaults() throws IOException {
        return new AlignerConfig(defaultProperties());
    }

    /**
     * The defaults overridden by the contents of the given properties file.
     */
    public static AlignerConfig load(final String fileName) throws IOException {
        final Properties props = defaultProperties();
        PropertiesUtils.load(props, fileName);
        LOGGER.debug("Aligner configuration overridden from {}", fileName);
        return new AlignerConfig(props);
    }

    public AlignerConfig withSeed(final long seed) {
        return new AlignerConfig(this, seed);
    }

    private static Properties defaultProperties() throws IOException {
        final Properties props = new Properties();
        PropertiesUtils.loadResource(props, DEFAULTS_RESOURCE);
        return props;
    }

    @Override
    public String toString() {
        return "AlignerConfig [harrisK=" + harrisK + ", harrisThreshold=" + harrisThreshold + ", harrisSigma=" + harrisSigma + ", harrisSuppression="
            + harrisSuppression + ", correlationWindow=" + correlationWindow + ", correlationMaxDistance=" + correlationMaxDistance + ", ransacThreshold="
            + ransacThreshold + ", ransacProbability=" + ransacProbability + ", ransacSeed=" + ransacSeed + ", ransacMaxEvaluations=" + ransacMaxEvaluations
            + "]";
    }
}
