/**
 * Gson codec for {@link com.resultkit.common.result.Result} values.
 *
 * <p>{@link com.resultkit.json.ResultJson} is the entry point. The adapters in this package can
 * also be installed into an existing {@code GsonBuilder} through {@link
 * com.resultkit.json.ResultJson#register(com.google.gson.GsonBuilder)}.
 */
package com.resultkit.json;
