/**
 * Annotations for declaring retriever tools on toolkit classes.
 */
package com.praga.annotations;
