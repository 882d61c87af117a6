package eu.okaeri.docengine.model.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class as a model declaration. Every non-static, non-transient field of the class
 * (and its superclasses) becomes a model field, see {@link ModelField} and {@link LargeObject}.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface Model {

    /**
     * Model name, defaults to the simple class name.
     */
    String name() default "";

    /**
     * Collection name in the store, defaults to the model name in snake case.
     */
    String collection() default "";

    /**
     * Appended to invalid primary key errors of this model, e.g. {@code Please make sure your SITE_ID contains a valid ObjectId.}
     */
    String identifierHint() default "";

    CompoundIndex[] indexes() default {};
}
