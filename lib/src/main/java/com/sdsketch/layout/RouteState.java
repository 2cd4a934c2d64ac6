package com.sdsketch.layout;

/** Progress of a single arrow through the routing strategies. */
public enum RouteState {
    UNROUTED,
    TRYING_STRAIGHT,
    TRYING_HVH,
    TRYING_VHV,
    TRYING_OFFSET_HVH,
    TRYING_OFFSET_VHV,
    TRYING_PERPENDICULAR,
    FORCED_FALLBACK,
    ROUTED
}
