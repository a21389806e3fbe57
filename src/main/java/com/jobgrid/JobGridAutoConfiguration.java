package com.jobgrid;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.jobgrid.catalog.JobCatalog;
import com.jobgrid.config.JobGridProperties;
import com.jobgrid.execution.ExecutorTaskQueue;
import com.jobgrid.execution.JobRunner;
import com.jobgrid.execution.TaskQueue;
import com.jobgrid.internal.JobGridMetrics;
import com.jobgrid.logging.JdbcJobLogStore;
import com.jobgrid.logging.JobLogStore;
import com.jobgrid.repository.JobResultRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import org.hibernate.boot.model.naming.CamelCaseToUnderscoresNamingStrategy;
import org.hibernate.boot.model.naming.Identifier;
import org.hibernate.engine.jdbc.env.spi.JdbcEnvironment;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfigurationPackage;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.jpa.JpaRepositoriesAutoConfiguration;
import org.springframework.boot.autoconfigure.orm.jpa.HibernateJpaAutoConfiguration;
import org.springframework.boot.autoconfigure.orm.jpa.HibernatePropertiesCustomizer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.PlatformTransactionManager;

@AutoConfiguration(before = { HibernateJpaAutoConfiguration.class, JpaRepositoriesAutoConfiguration.class })
@AutoConfigurationPackage(basePackageClasses = JobGridAutoConfiguration.class)
@ComponentScan("com.jobgrid")
@EnableScheduling
@EnableConfigurationProperties(JobGridProperties.class)
public class JobGridAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(name = "jobgridObjectMapper")
    public ObjectMapper jobgridObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }

    @Bean
    @ConditionalOnMissingBean(name = "jobgridHibernatePropertiesCustomizer")
    public HibernatePropertiesCustomizer jobgridHibernatePropertiesCustomizer(JobGridProperties properties) {
        return hibernateProperties -> {
            String prefix = properties.getDatabase().getTablePrefix();
            if (prefix != null && !prefix.trim().isEmpty()) {
                hibernateProperties.put("hibernate.physical_naming_strategy",
                        new CamelCaseToUnderscoresNamingStrategy() {
                            @Override
                            public Identifier toPhysicalTableName(Identifier name, JdbcEnvironment jdbcEnvironment) {
                                Identifier original = super.toPhysicalTableName(name, jdbcEnvironment);
                                // Only intercept JobGrid tables
                                if (original.getText().toLowerCase().startsWith("jobgrid_")) {
                                    return new Identifier(prefix.trim() + original.getText(), original.isQuoted());
                                }
                                return original;
                            }
                        });
            }
        };
    }

    @Bean
    @ConditionalOnMissingBean
    public JobCatalog jobgridJobCatalog(ObjectProvider<JobWorker> workers) {
        return JobCatalog.fromWorkers(workers.orderedStream().toList());
    }

    @Bean
    @ConditionalOnMissingBean(JobLogStore.class)
    public JdbcJobLogStore jobgridJobLogStore(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager,
            JobGridProperties properties) {
        return new JdbcJobLogStore(jdbcTemplate, transactionManager, properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobGridMetrics jobgridMetrics(JobResultRepository jobResultRepository,
            ObjectProvider<MeterRegistry> meterRegistry) {
        return new JobGridMetrics(jobResultRepository, meterRegistry.getIfAvailable(() -> Metrics.globalRegistry));
    }

    @Bean
    @ConditionalOnMissingBean(TaskQueue.class)
    @ConditionalOnProperty(prefix = "jobgrid.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ExecutorTaskQueue jobgridTaskQueue(JobRunner jobRunner, JobGridProperties properties) {
        return new ExecutorTaskQueue(jobRunner, properties.getWorker().getWorkerCount());
    }
}
