/**
 * Helpers for the public App Store web front end.
 */
@NullMarked
package io.quiby.appstore;

import org.jspecify.annotations.NullMarked;
