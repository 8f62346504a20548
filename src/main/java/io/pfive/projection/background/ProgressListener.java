// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.background;

/// Receives progress of a projection call, one step per finished variable. Passed explicitly with
/// each request instead of through any global verbosity setting. Implementations must be
/// threadsafe, as steps are reported from worker threads.
public interface ProgressListener {

    ProgressListener NONE = new ProgressListener() {
        @Override
        public void beginTask (String title, int totalSteps) { }

        @Override
        public void increment (int n) { }
    };

    void beginTask (String title, int totalSteps);

    void increment (int n);

    default void increment () {
        increment(1);
    }

}
