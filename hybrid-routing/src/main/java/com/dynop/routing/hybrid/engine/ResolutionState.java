package com.dynop.routing.hybrid.engine;

/**
 * States of the resolution decision.
 *
 * <ul>
 *   <li>{@link #GEOMETRY_ONLY} - terminal; a great-circle estimate is returned without network access</li>
 *   <li>{@link #ATTEMPT_ROUTE} - cache lookup, then a coalesced provider call</li>
 *   <li>{@link #ROUTED} - terminal; the provider (or a cached provider answer) supplied the route</li>
 *   <li>{@link #FALLBACK} - terminal; routing failed and an estimate was substituted</li>
 * </ul>
 */
public enum ResolutionState {
    GEOMETRY_ONLY,
    ATTEMPT_ROUTE,
    ROUTED,
    FALLBACK
}
