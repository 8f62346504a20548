// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.geometry;

/// The share of one record's footprint that falls into the pixel at the given flat index.
public record PixelFraction (int pixel, double fraction) {

    /// Receives binning output without allocating a PixelFraction per pair.
    @FunctionalInterface
    public interface Sink {
        void accept (int pixel, double fraction);
    }

}
