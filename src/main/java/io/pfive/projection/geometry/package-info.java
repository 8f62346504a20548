// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

/// Placement of records on the projection plane. Everything in this package works in code units
/// or in fractions of the box length, never in user units: conversion happens once when a request
/// is built.
package io.pfive.projection.geometry;
