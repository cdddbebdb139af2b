/**
 * Server wiring: {@link com.praga.bootstrap.PragaBootstrap} turns configuration into a
 * {@link com.praga.bootstrap.ServerContext} held by {@link com.praga.bootstrap.GlobalContext}.
 */
package com.praga.bootstrap;
