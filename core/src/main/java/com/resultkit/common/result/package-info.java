/**
 * Results: operation outcomes held as values rather than thrown.
 *
 * <p>This package provides a consistent way to return either a value or an error without relying
 * on exceptions for control flow. The central classes are:
 *
 * <ul>
 *   <li>{@link com.resultkit.common.result.Result} - either an {@code Ok} carrying a value or an
 *       {@code Err} carrying an error, with combinators to transform, chain and extract
 *   <li>{@link com.resultkit.common.result.ErrorPayload} - the conventional typed error: a
 *       discriminant, context fields and an optional cause
 *   <li>{@link com.resultkit.common.result.ResultRecord} - the plain, behavior-free shape of a
 *       result
 *   <li>{@link com.resultkit.common.result.Results} - free-function forms of the operations and the
 *       adapters that turn callables, futures and records into results
 * </ul>
 *
 * <p>Example usage:
 *
 * <pre>
 * // Method that returns either a Config or a typed error
 * public Result&lt;Config, ErrorPayload&gt; loadConfig(Path path) {
 *     Result&lt;String, Exception&gt; text = Results.result(() -&gt; Files.readString(path));
 *     if (text.isErr()) {
 *         return text.annotate("ConfigUnreadable", Map.of("path", path.toString()));
 *     }
 *     return parseConfig(text.getValue());
 * }
 *
 * // Calling code that handles the result
 * Result&lt;Config, ErrorPayload&gt; config = loadConfig(path);
 * if (config.isOk()) {
 *     start(config.getValue());
 * } else {
 *     ErrorPayload error = config.getError();
 *     // Dispatch on error.type(), or walk error.causeChain()...
 * }
 * </pre>
 */
package com.resultkit.common.result;
