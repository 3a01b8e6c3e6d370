package com.phillippitts.visqol.config.engine;

import com.phillippitts.visqol.domain.QualityMode;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Engine-wide settings. Binds to properties prefixed with "visqol".
 *
 * <p>Example application.properties:
 * <pre>
 * visqol.mode=speech
 * visqol.model-directory=/etc/visqol/models
 * </pre>
 *
 * @param mode           mode of the default engine
 * @param modelDirectory directory searched for model resources before the classpath, may be null
 */
@ConfigurationProperties(prefix = "visqol")
@Validated
public record VisqolProperties(
        @NotNull(message = "Quality mode must not be null")
        @DefaultValue("audio")
        QualityMode mode,

        String modelDirectory
) {

    public static VisqolProperties defaults() {
        return new VisqolProperties(QualityMode.AUDIO, null);
    }

    public boolean hasModelDirectory() {
        return modelDirectory != null && !modelDirectory.isBlank();
    }
}
