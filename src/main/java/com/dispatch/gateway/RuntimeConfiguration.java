package com.dispatch.gateway;

import com.dispatch.adapters.AdapterRegistry;
import com.dispatch.adapters.AgentAdapter;
import com.dispatch.adapters.ShellAdapter;
import com.dispatch.eventlog.EventLog;
import com.dispatch.eventlog.JdbcEventLog;
import com.dispatch.observability.DoctorCommand;
import com.dispatch.observability.RuntimeMetrics;
import com.dispatch.sessions.JdbcSessionStore;
import com.dispatch.sessions.RetentionService;
import com.dispatch.sessions.RunSessionManager;
import com.dispatch.sessions.SessionStore;
import com.dispatch.shared.config.ConfigLoader;
import com.dispatch.shared.config.DispatchConfig;
import com.dispatch.workspace.FileSystemSessionDirectory;
import com.dispatch.workspace.SessionDirectory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the runtime. The datasource and ObjectMapper come from Spring Boot; everything else is
 * built from ~/.dispatch/config.yaml (or {@code dispatch.config}).
 */
@Configuration
public class RuntimeConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RuntimeConfiguration.class);

    @Bean
    public DispatchConfig dispatchConfig(@Value("${dispatch.config:}") String configPath) {
        var config = configPath.isBlank() ? ConfigLoader.load() : ConfigLoader.load(Path.of(configPath));
        log.info("Workspaces root: {}", config.workspacesRoot());
        return config;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RuntimeMetrics runtimeMetrics() {
        return new RuntimeMetrics();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService adapterExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("adapter-io-"));
    }

    @Bean
    public AdapterRegistry adapterRegistry(DispatchConfig config, ExecutorService adapterExecutor) {
        var registry = new AdapterRegistry();
        registry.register(new ShellAdapter(config.shell(), adapterExecutor));
        registry.register(new AgentAdapter(config.agent(), adapterExecutor));
        return registry;
    }

    @Bean
    public EventLog eventLog(DataSource dataSource, ObjectMapper mapper, DispatchConfig config, Clock clock) {
        return new JdbcEventLog(dataSource, mapper, config.runtime().readPageSize(), clock);
    }

    @Bean
    public SessionStore sessionStore(DataSource dataSource, ObjectMapper mapper) {
        return new JdbcSessionStore(dataSource, mapper);
    }

    @Bean
    public SessionDirectory sessionDirectory(DispatchConfig config) {
        return new FileSystemSessionDirectory(Path.of(config.workspacesRoot()));
    }

    @Bean(destroyMethod = "shutdown")
    public RunSessionManager runSessionManager(AdapterRegistry adapters, EventLog eventLog, SessionStore store,
                                               SessionDirectory directory, DispatchConfig config,
                                               RuntimeMetrics metrics, ExecutorService adapterExecutor, Clock clock) {
        var manager = new RunSessionManager(adapters, eventLog, store, directory, config.runtime(), metrics,
                adapterExecutor, clock);
        manager.recoverOrphans();
        return manager;
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public RetentionService retentionService(SessionStore store, EventLog eventLog, RunSessionManager manager,
                                             DispatchConfig config, Clock clock) {
        return new RetentionService(store, eventLog, manager, config.retention(), clock);
    }

    @Bean
    public DoctorCommand doctorCommand(DataSource dataSource, DispatchConfig config) {
        return new DoctorCommand(dataSource, config);
    }
}
