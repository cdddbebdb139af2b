/**
 * Per-type validators deciding whether a cached page may be served.
 */
package com.praga.cache.validation;
