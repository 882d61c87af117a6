package eu.okaeri.docengine.model.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Stores the field value outside of the document. {@code String} fields become large text,
 * everything else a large file.
 */
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
public @interface LargeObject {

    /**
     * Keep replaced payloads instead of deleting them.
     */
    boolean versioning() default false;

    AutoDelete autodelete() default AutoDelete.UNLESS_VERSIONED;

    enum AutoDelete {
        UNLESS_VERSIONED,
        ALWAYS,
        NEVER
    }
}
