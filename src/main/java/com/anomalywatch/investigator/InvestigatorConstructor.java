package com.anomalywatch.investigator;

/**
 * Builds an investigator bound to the given context.
 */
@FunctionalInterface
public interface InvestigatorConstructor {

    Investigator construct(InvestigatorContext context);
}
