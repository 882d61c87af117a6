package eu.okaeri.docengine.model.annotation;

import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;

@Retention(RetentionPolicy.RUNTIME)
public @interface CompoundIndex {

    IndexField[] value();

    boolean unique() default false;

    boolean sparse() default false;
}
