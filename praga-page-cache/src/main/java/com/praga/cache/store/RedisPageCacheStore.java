package com.praga.cache.store;

import com.praga.cache.CacheRecord;
import com.praga.cache.PageCacheException;
import com.praga.cache.PageCacheStore;
import com.praga.page.PageAddress;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.exceptions.JedisException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeSet;

/**
 * Redis-backed {@link PageCacheStore}. Each record is a hash at {@code <prefix>:<address>} with
 * fields {@code payload}, {@code createdAt} (epoch millis), {@code valid} and an optional
 * {@code parent}. Secondary keys:
 * <ul>
 *   <li>{@code <prefix>:versions:<root/type:id>} sorted set of cached versions</li>
 *   <li>{@code <prefix>:children:<parent address>} set of child addresses</li>
 *   <li>{@code <prefix>:pages:<root>/<type>} set of addresses of one page type</li>
 * </ul>
 */
public final class RedisPageCacheStore implements PageCacheStore {

    private static final String FIELD_PAYLOAD = "payload";
    private static final String FIELD_CREATED_AT = "createdAt";
    private static final String FIELD_VALID = "valid";
    private static final String FIELD_PARENT = "parent";

    private final JedisPool pool;
    private final String keyPrefix;

    public RedisPageCacheStore(String host, int port, String keyPrefix) {
        this(host, port, keyPrefix, new JedisPoolConfig());
    }

    public RedisPageCacheStore(String host, int port, String keyPrefix, JedisPoolConfig poolConfig) {
        Objects.requireNonNull(host, "host");
        this.keyPrefix = Objects.requireNonNull(keyPrefix, "keyPrefix");
        this.pool = new JedisPool(poolConfig, host, port);
    }

    @Override
    public Optional<CacheRecord> find(PageAddress address) {
        try (var jedis = pool.getResource()) {
            Map<String, String> fields = jedis.hgetAll(recordKey(address));
            if (fields == null || fields.get(FIELD_PAYLOAD) == null) {
                return Optional.empty();
            }
            Instant createdAt = Instant.ofEpochMilli(Long.parseLong(fields.getOrDefault(FIELD_CREATED_AT, "0")));
            boolean valid = !"false".equals(fields.get(FIELD_VALID));
            String parent = fields.get(FIELD_PARENT);
            return Optional.of(new CacheRecord(address, fields.get(FIELD_PAYLOAD), createdAt, valid,
                    parent == null ? null : PageAddress.parse(parent)));
        } catch (JedisException | IllegalArgumentException e) {
            throw new PageCacheException("Redis find failed for " + address + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void put(CacheRecord record) {
        PageAddress address = record.address();
        Map<String, String> fields = new HashMap<>();
        fields.put(FIELD_PAYLOAD, record.payload());
        fields.put(FIELD_CREATED_AT, Long.toString(record.createdAt().toEpochMilli()));
        fields.put(FIELD_VALID, Boolean.toString(record.valid()));
        try (var jedis = pool.getResource()) {
            String key = recordKey(address);
            String previousParent = jedis.hget(key, FIELD_PARENT);
            if (previousParent != null && !previousParent.equals(parentString(record))) {
                jedis.srem(childrenKey(previousParent), address.toString());
                jedis.hdel(key, FIELD_PARENT);
            }
            if (record.hasParent()) {
                fields.put(FIELD_PARENT, record.parent().toString());
                jedis.sadd(childrenKey(record.parent().toString()), address.toString());
            }
            jedis.hset(key, fields);
            jedis.zadd(versionsKey(address), address.version(), Integer.toString(address.version()));
            jedis.sadd(typeKey(address.root(), address.type()), address.toString());
        } catch (JedisException e) {
            throw new PageCacheException("Redis put failed for " + address + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean markInvalid(PageAddress address) {
        try (var jedis = pool.getResource()) {
            String key = recordKey(address);
            if (!jedis.exists(key)) {
                return false;
            }
            jedis.hset(key, FIELD_VALID, "false");
            return true;
        } catch (JedisException e) {
            throw new PageCacheException("Redis markInvalid failed for " + address + ": " + e.getMessage(), e);
        }
    }

    @Override
    public int markInvalidAllVersions(PageAddress address) {
        try (var jedis = pool.getResource()) {
            int marked = 0;
            for (String v : jedis.zrange(versionsKey(address), 0, -1)) {
                String key = recordKey(address.withVersion(Integer.parseInt(v)));
                if (jedis.exists(key)) {
                    jedis.hset(key, FIELD_VALID, "false");
                    marked++;
                }
            }
            return marked;
        } catch (JedisException | NumberFormatException e) {
            throw new PageCacheException("Redis markInvalidAllVersions failed for " + address.prefix() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public OptionalInt latestVersion(PageAddress address) {
        try (var jedis = pool.getResource()) {
            List<String> top = jedis.zrevrange(versionsKey(address), 0, 0);
            return top == null || top.isEmpty() ? OptionalInt.empty() : OptionalInt.of(Integer.parseInt(top.get(0)));
        } catch (JedisException | NumberFormatException e) {
            throw new PageCacheException("Redis latestVersion failed for " + address.prefix() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean remove(PageAddress address) {
        try (var jedis = pool.getResource()) {
            String key = recordKey(address);
            String parent = jedis.hget(key, FIELD_PARENT);
            if (parent != null) {
                jedis.srem(childrenKey(parent), address.toString());
            }
            jedis.zrem(versionsKey(address), Integer.toString(address.version()));
            jedis.srem(typeKey(address.root(), address.type()), address.toString());
            return jedis.del(key) > 0;
        } catch (JedisException e) {
            throw new PageCacheException("Redis remove failed for " + address + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<CacheRecord> children(PageAddress parent) {
        try (var jedis = pool.getResource()) {
            return findAll(jedis.smembers(childrenKey(parent.toString())));
        } catch (JedisException e) {
            throw new PageCacheException("Redis children failed for " + parent + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<CacheRecord> findByType(String root, String type) {
        try (var jedis = pool.getResource()) {
            return findAll(jedis.smembers(typeKey(root, type)));
        } catch (JedisException e) {
            throw new PageCacheException("Redis findByType failed for " + root + "/" + type + ": " + e.getMessage(), e);
        }
    }

    private List<CacheRecord> findAll(Set<String> addresses) {
        List<CacheRecord> records = new ArrayList<>();
        for (String value : new TreeSet<>(addresses)) {
            find(PageAddress.parse(value)).ifPresent(records::add);
        }
        records.sort(Comparator.comparing(CacheRecord::address));
        return records;
    }

    @Override
    public void close() {
        pool.close();
    }

    private String recordKey(PageAddress address) {
        return keyPrefix + ":" + address.prefix() + "@" + address.version();
    }

    private String versionsKey(PageAddress address) {
        return keyPrefix + ":versions:" + address.prefix();
    }

    private String childrenKey(String parent) {
        return keyPrefix + ":children:" + parent;
    }

    private String typeKey(String root, String type) {
        return keyPrefix + ":pages:" + root + "/" + type;
    }

    private static String parentString(CacheRecord record) {
        return record.hasParent() ? record.parent().toString() : null;
    }
}
