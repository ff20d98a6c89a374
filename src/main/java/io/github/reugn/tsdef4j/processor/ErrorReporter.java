package io.github.reugn.tsdef4j.processor;

import io.github.reugn.tsdef4j.convert.ConversionException;

import javax.annotation.processing.Messager;
import javax.lang.model.element.Element;
import javax.tools.Diagnostic;

/**
 * Interface for reporting compilation errors.
 */
@FunctionalInterface
interface ErrorReporter {
    /**
     * Reports an error on the given element.
     *
     * @param element the element where the error occurred, or {@code null} for a global error
     * @param message the error message
     */
    void error(Element element, String message);

    /**
     * Reports a conversion failure on the type it aborted.
     */
    default void error(Element element, ConversionException e) {
        error(element, "Cannot generate TypeScript for " + element.getSimpleName() + ": " + e.getMessage());
    }

    static ErrorReporter forMessager(Messager messager) {
        return (element, message) -> {
            if (element == null) {
                messager.printMessage(Diagnostic.Kind.ERROR, message);
            } else {
                messager.printMessage(Diagnostic.Kind.ERROR, message, element);
            }
        };
    }
}
