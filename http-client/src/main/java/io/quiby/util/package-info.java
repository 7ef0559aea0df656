@NullMarked
package io.quiby.util;

import org.jspecify.annotations.NullMarked;
