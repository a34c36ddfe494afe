package eu.xfsc.cv.server.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

import eu.xfsc.cv.core.config.CoreConfig;

/**
 * Credential verifier core service configuration.
 */
@Configuration
@Import(value = {CoreConfig.class})
public class ServiceConfig {

}
