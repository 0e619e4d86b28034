package dev.fumaz.sprout.descriptor;

/**
 * A compiled call to a constructor or method, taking its arguments positionally.
 */
@FunctionalInterface
public interface Invoker {

    Object invoke(Object[] arguments) throws Throwable;

}
