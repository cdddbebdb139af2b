/**
 * External page cache stores: PostgreSQL over JDBC and Redis over Jedis.
 */
package com.praga.cache.store;
