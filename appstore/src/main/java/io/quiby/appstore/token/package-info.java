/**
 * Extraction of the web bearer token embedded in App Store landing pages.
 */
@NullMarked
package io.quiby.appstore.token;

import org.jspecify.annotations.NullMarked;
