/**
 * {@link io.quiby.client.http.HttpClient} implementation on top of {@code java.net.http.HttpClient}.
 */
@NullMarked
package io.quiby.client.http.jdk;

import org.jspecify.annotations.NullMarked;
