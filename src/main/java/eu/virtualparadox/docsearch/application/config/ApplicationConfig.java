package eu.virtualparadox.docsearch.application.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tenant layout of the service: which document folder backs which tenant.
 * <pre>
 * docsearch:
 *   tenants:
 *     autolife: ./knowledge/autolife
 * </pre>
 */
@Configuration
@ConfigurationProperties(prefix = "docsearch")
@Getter @Setter
public class ApplicationConfig {

    /**
     * Tenant id to document folder. Folders are read directly, sub-folders are ignored.
     */
    private Map<String, Path> tenants = new LinkedHashMap<>();

}
