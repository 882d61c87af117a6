package eu.okaeri.docengine.model.annotation;

import eu.okaeri.docengine.model.FieldType;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
public @interface ModelField {

    FieldType type() default FieldType.AUTO;

    /**
     * Storage column, defaults to the field name ({@code <name>_id} for foreign keys).
     */
    String column() default "";

    boolean index() default false;

    boolean unique() default false;

    boolean sparse() default false;

    boolean descending() default false;

    /**
     * Referenced model class, makes the field a foreign key.
     */
    Class<?> references() default void.class;
}
