package org.scholargraph.analytics.community;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the configured {@link ICommunityDetector}.
 * <p>
 * Configuration:
 * <pre>
 * communityDetector {
 *   className = "org.scholargraph.analytics.community.LouvainCommunityDetector"
 *   options {
 *     resolution = 1.0
 *     seed = 42
 *   }
 * }
 * </pre>
 * The class must have a public constructor taking a {@link Config}. If it cannot be loaded
 * or instantiated, the {@link SingletonCommunityDetector} is returned instead.
 */
public final class CommunityDetectors {

    private static final Logger log = LoggerFactory.getLogger(CommunityDetectors.class);

    public static final String DEFAULT_CLASS_NAME = LouvainCommunityDetector.class.getName();

    private CommunityDetectors() {
    }

    /**
     * @param options The {@code communityDetector} block; may be empty.
     * @return The detector to use for the lifetime of the caller.
     */
    public static ICommunityDetector create(Config options) {
        String className = options.hasPath("className") ? options.getString("className") : DEFAULT_CLASS_NAME;
        Config detectorOptions = options.hasPath("options") ? options.getConfig("options") : ConfigFactory.empty();
        try {
            Class<?> detectorClass = Class.forName(className);
            if (!ICommunityDetector.class.isAssignableFrom(detectorClass)) {
                log.warn("Community detector class {} does not implement ICommunityDetector, using singleton communities", className);
                return new SingletonCommunityDetector();
            }
            ICommunityDetector detector = (ICommunityDetector) detectorClass
                .getConstructor(Config.class)
                .newInstance(detectorOptions);
            log.debug("Loaded community detector: {}", detector.name());
            return detector;
        } catch (ReflectiveOperationException | LinkageError e) {
            log.warn("Community detector {} is unavailable ({}), using singleton communities", className, e.toString());
            return new SingletonCommunityDetector();
        }
    }
}
