// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.engine;

/// How the contributions landing in one pixel are combined.
public enum AggregationMode {
    /// Weighted mean of the values, using the request's Weighting.
    MEAN,
    /// Plain sum of value times footprint share. Weighting is not applied, so a `mass` map in this
    /// mode holds the mass deposited in each pixel.
    SUM
}
