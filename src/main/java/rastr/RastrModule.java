package rastr;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import rastr.dal.ConfigurationService;
import rastr.dal.HalftoneConfig;
import rastr.domain.halftone.HalftoneEngine;
import rastr.domain.halftone.LayerCompositor;

/**
 * Wires the halftone engine for the image acquisition and print collaborators
 * @since 19/10/2026
 */
public class RastrModule extends AbstractModule {
    private final ConfigurationService configurationService;

    public RastrModule(ConfigurationService configurationService) {
        this.configurationService = configurationService;
    }

    @Override
    protected void configure() {
        bind(ConfigurationService.class).toInstance(configurationService);
        bind(LayerCompositor.class).in(Singleton.class);
    }

    @Provides
    @Singleton
    public HalftoneConfig provideHalftoneConfig(ConfigurationService service) {
        return service.getHalftoneConfig();
    }

    @Provides
    @Singleton
    public HalftoneEngine provideHalftoneEngine(HalftoneConfig config, LayerCompositor compositor) {
        return new HalftoneEngine(config, compositor);
    }
}
