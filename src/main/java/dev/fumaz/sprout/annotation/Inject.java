package dev.fumaz.sprout.annotation;

import java.lang.annotation.*;

/**
 * Marks the constructor to use when a type declares several, or a field to assign when a type is built with its
 * no-argument constructor.
 */
@Target({ElementType.CONSTRUCTOR, ElementType.FIELD})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Inject {
}
