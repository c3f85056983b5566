/** Dispatch on error discriminants, with optional exhaustiveness over a declared domain. */
package com.resultkit.common.match;
