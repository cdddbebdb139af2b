package com.praga.bootstrap;

import com.praga.annotations.RetrieverTool;
import com.praga.annotations.ToolParam;
import com.praga.cache.InMemoryPageCacheStore;
import com.praga.config.CacheStoreType;
import com.praga.config.PragaConfig;
import com.praga.page.DuplicateRegistrationException;
import com.praga.page.PageAddress;
import com.praga.router.PageProducer;
import com.praga.tools.RetrieverToolkit;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PragaBootstrapTest {

    private static final PragaConfig MEMORY = PragaConfig.builder()
            .root("memo")
            .cacheStoreType(CacheStoreType.MEMORY)
            .workerThreads(2)
            .build();

    /** Toolkit whose only tool reads memos through the router. */
    static class MemoToolkit extends RetrieverToolkit {

        MemoToolkit() {
            super("memos");
        }

        @RetrieverTool(cache = true)
        public List<MemoPage> readMemo(@ToolParam("id") String id) {
            return List.of((MemoPage) GlobalContext.get().getRouter().get(PageAddress.of("memo", "memo", id)));
        }
    }

    @AfterEach
    void tearDown() {
        ServerContext context = GlobalContext.clear();
        if (context != null) {
            context.close();
        }
    }

    @Test
    void initialize_wiresRouterFromConfig() {
        ServerContext context = PragaBootstrap.initialize(MEMORY);

        assertSame(context, GlobalContext.get());
        assertEquals("memo", context.getRoot());
        assertSame(MEMORY, context.getConfig());
        assertInstanceOf(InMemoryPageCacheStore.class, context.getStore());
        assertSame(context.getRouter().getValidators(), context.getValidators());
        assertEquals(PageAddress.of("memo", "memo", "1"), context.getRouter().newAddress("memo", "1"));
    }

    @Test
    void initialize_secondCallFails() {
        PragaBootstrap.initialize(MEMORY);

        assertThrows(IllegalStateException.class, () -> PragaBootstrap.initialize(MEMORY));
    }

    @Test
    void initialize_recordsMetricsInGivenRegistry() {
        SimpleMeterRegistry meters = new SimpleMeterRegistry();
        ServerContext context = PragaBootstrap.initialize(MEMORY, meters);
        context.getRouter().registerHandler("memo", MemoPage.class,
                PageProducer.blocking(a -> new MemoPage(a, "memo " + a.id())));

        context.getRouter().get("memo/memo:1");
        context.getRouter().get("memo/memo:1");

        assertEquals(1.0, meters.get("praga.page.requests").tag("outcome", "produced").counter().count());
        assertEquals(1.0, meters.get("praga.page.requests").tag("outcome", "cache_hit").counter().count());
    }

    @Test
    void initialize_jdbcStoreFallsBackToMemoryWhenDatabaseIsUnreachable() {
        PragaConfig jdbc = PragaConfig.builder()
                .root("memo")
                .cacheStoreType(CacheStoreType.JDBC)
                .dbHost("127.0.0.1")
                .dbPort(1)
                .build();

        ServerContext context = PragaBootstrap.initialize(jdbc);

        assertInstanceOf(InMemoryPageCacheStore.class, context.getStore());
    }

    @Test
    void registerToolkit_rejectsDuplicateName() {
        ServerContext context = PragaBootstrap.initialize(MEMORY);
        context.registerToolkit(new MemoToolkit());

        DuplicateRegistrationException e = assertThrows(DuplicateRegistrationException.class,
                () -> context.registerToolkit(new MemoToolkit()));
        assertEquals("Toolkit", e.getKind());
        assertEquals("memos", e.getName());
        assertEquals(1, context.getToolkits().size());
    }

    @Test
    void toolkit_readsPagesThroughRouter() {
        ServerContext context = PragaBootstrap.initialize(MEMORY);
        context.getRouter().registerHandler("memo", MemoPage.class,
                PageProducer.blocking(a -> new MemoPage(a, "memo " + a.id())));
        context.registerToolkit(new MemoToolkit());

        RetrieverToolkit toolkit = context.findToolkit("memos").orElseThrow();
        Map<String, Object> response = toolkit.invokeTool("readMemo", "7");

        @SuppressWarnings("unchecked")
        List<Map<String, Object>> results = (List<Map<String, Object>>) response.get("results");
        assertEquals("memo/memo:7", results.get(0).get("uri"));
        assertEquals("memo 7", results.get(0).get("body"));
        assertTrue(context.findToolkit("other").isEmpty());
    }
}
