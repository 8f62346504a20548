// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

///  This package contains classes for reporting progress of projection calls, which may take a while
///  on large snapshots. Progress is counted in finished variables.
package io.pfive.projection.background;
