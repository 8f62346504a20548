// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

/// Reading projection requests from JSON documents and writing summaries of results, so that
/// batch scripts can describe projections without Java code.
package io.pfive.projection.store;
