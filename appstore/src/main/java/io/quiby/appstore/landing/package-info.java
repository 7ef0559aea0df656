@NullMarked
package io.quiby.appstore.landing;

import org.jspecify.annotations.NullMarked;
