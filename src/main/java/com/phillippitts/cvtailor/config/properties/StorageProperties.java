package com.phillippitts.cvtailor.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Root directory of the file-system content store.
 */
@Validated
@ConfigurationProperties(prefix = "generation.storage")
public class StorageProperties {

    @NotBlank
    private final String root;

    @ConstructorBinding
    public StorageProperties(String root) {
        this.root = root == null ? "./data" : root;
    }

    public String getRoot() {
        return root;
    }
}
