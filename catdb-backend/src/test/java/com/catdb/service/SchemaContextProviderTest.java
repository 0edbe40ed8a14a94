package com.catdb.service;

import com.catdb.registry.ConnectionRegistry;
import com.catdb.registry.ConnectionUnavailableException;
import com.catdb.registry.LiveConnection;
import com.catdb.schema.SchemaIntrospector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SchemaContextProviderTest {

    private ConnectionRegistry registry;
    private SchemaIntrospector introspector;
    private SchemaContextProvider provider;

    @BeforeEach
    void setUp() {
        registry = mock(ConnectionRegistry.class);
        introspector = mock(SchemaIntrospector.class);
        provider = new SchemaContextProvider(registry, introspector);
    }

    private LiveConnection liveDescribedAs(String name, String text) {
        LiveConnection live = mock(LiveConnection.class);
        when(registry.get(name)).thenReturn(live);
        when(introspector.describe(live)).thenReturn(text);
        return live;
    }

    private void unavailable(String name) {
        when(registry.get(name)).thenThrow(new ConnectionUnavailableException(name, "down", null));
    }

    @Test
    void explicitNameWins() {
        liveDescribedAs("reporting", "Tables: r");
        when(registry.liveNames()).thenReturn(List.of("other"));

        assertThat(provider.resolve("reporting"))
                .hasValueSatisfying(ctx -> {
                    assertThat(ctx.connectionName()).isEqualTo("reporting");
                    assertThat(ctx.text()).isEqualTo("Tables: r");
                });
        verify(registry, never()).liveNames();
    }

    @Test
    void explicitNameThatCannotOpenYieldsNothing() {
        unavailable("broken");

        assertThat(provider.resolve("broken")).isEmpty();
    }

    @Test
    void prefersMostRecentLiveConnection() {
        liveDescribedAs("older", "old");
        liveDescribedAs("newer", "new");
        when(registry.liveNames()).thenReturn(List.of("older", "newer"));

        assertThat(provider.resolve(null)).hasValueSatisfying(ctx -> assertThat(ctx.connectionName()).isEqualTo("newer"));
    }

    @Test
    void fallsBackToFirstConfiguredConnectionThatOpens() {
        unavailable("alpha");
        liveDescribedAs("beta", "b");
        when(registry.liveNames()).thenReturn(List.of());
        when(registry.list()).thenReturn(List.of("alpha", "beta", "gamma"));

        assertThat(provider.resolve(" ")).hasValueSatisfying(ctx -> assertThat(ctx.connectionName()).isEqualTo("beta"));
        verify(registry, never()).get("gamma");
    }

    @Test
    void noConnectionsYieldsNothing() {
        when(registry.liveNames()).thenReturn(List.of());
        when(registry.list()).thenReturn(List.of());

        assertThat(provider.resolve(null)).isEmpty();
        verify(registry, never()).get(anyString());
    }
}
