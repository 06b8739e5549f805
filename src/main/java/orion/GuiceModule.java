package orion;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import okhttp3.OkHttpClient;
import orion.dal.BackendConfig;
import orion.dal.SyncConfig;
import orion.domain.EngineEventBus;
import orion.domain.api.HttpDeviceApi;
import orion.domain.api.IDeviceApi;
import orion.domain.scheduling.ExecutorEngineScheduler;
import orion.domain.scheduling.IEngineScheduler;
import orion.domain.status.ChannelManager;
import orion.domain.status.PollLoop;
import orion.domain.status.SnapshotCodec;
import orion.domain.status.StatusEngine;
import orion.domain.status.StatusStore;
import orion.domain.status.StreamSubscriber;
import orion.domain.status.ThumbnailResolver;

import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * Wires one status engine against the configured device
 * @author Orion team
 * @since 16/10/2026
 */
public class GuiceModule extends AbstractModule {
    private final BackendConfig backendConfig;
    private final SyncConfig syncConfig;

    public GuiceModule(BackendConfig backendConfig, SyncConfig syncConfig) {
        this.backendConfig = backendConfig;
        this.syncConfig = syncConfig;
    }

    @Override
    protected void configure() {
        bind(BackendConfig.class).toInstance(backendConfig);
        bind(SyncConfig.class).toInstance(syncConfig);

        bind(EngineEventBus.class).toInstance(new EngineEventBus());
        bind(Random.class).toInstance(new Random());

        bind(IEngineScheduler.class).to(ExecutorEngineScheduler.class).in(Singleton.class);
        bind(IDeviceApi.class).to(HttpDeviceApi.class).in(Singleton.class);

        // One instance of each engine component, they share the engine thread and the store
        bind(SnapshotCodec.class).in(Singleton.class);
        bind(ThumbnailResolver.class).in(Singleton.class);
        bind(StatusStore.class).in(Singleton.class);
        bind(PollLoop.class).in(Singleton.class);
        bind(StreamSubscriber.class).in(Singleton.class);
        bind(ChannelManager.class).in(Singleton.class);
        bind(StatusEngine.class).in(Singleton.class);
    }

    /**
     * Shared connection pool; per-call timeouts are applied by the device API client
     */
    @Provides
    @Singleton
    public OkHttpClient provideHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(backendConfig.requestTimeoutMs(), TimeUnit.MILLISECONDS)
                .retryOnConnectionFailure(true)
                .build();
    }
}
