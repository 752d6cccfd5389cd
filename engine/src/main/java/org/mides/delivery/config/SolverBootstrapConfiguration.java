package org.mides.delivery.config;

import com.google.ortools.Loader;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;

/**
 * Loads the OR-Tools JNI libraries once at startup. The constraint solver tour fails with an
 * {@link UnsatisfiedLinkError} if this has not run.
 */
@Configuration
public class SolverBootstrapConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(SolverBootstrapConfiguration.class);

    @PostConstruct
    public void loadSolverLibraries() {
        Loader.loadNativeLibraries();
        logger.info("Loaded OR-Tools native libraries");
    }
}
