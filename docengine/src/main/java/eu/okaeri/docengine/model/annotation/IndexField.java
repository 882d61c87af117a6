package eu.okaeri.docengine.model.annotation;

import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;

@Retention(RetentionPolicy.RUNTIME)
public @interface IndexField {

    /**
     * Storage column, used as given.
     */
    String value();

    boolean descending() default false;
}
