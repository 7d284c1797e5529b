package io.suite4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.suite4j.Discovery;
import io.suite4j.ReportSink;
import io.suite4j.Scheduler;
import io.suite4j.core.CompositeReportSink;
import io.suite4j.internal.EventLoopScheduler;
import io.suite4j.internal.mongo.MongoReportSink;
import io.suite4j.internal.mongo.MongoResultStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

/**
 * Spring Boot auto-configuration entrypoint for the run coordinator.
 *
 * <p>Every {@link ReportSink} bean in the context receives the run's reports. When Spring Data
 * MongoDB is present a {@link MongoReportSink} is registered as one of them.
 */
@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration")
@ConditionalOnClass(Scheduler.class)
@ConditionalOnProperty(prefix = "suite4j", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(MongoReportProperties.class)
public class SuiteConfig {

    @Bean
    @ConditionalOnMissingBean
    @ConfigurationProperties(prefix = "suite4j")
    public SchedulerProperties schedulerProperties() {
        return new SchedulerProperties();
    }

    @Bean
    @ConditionalOnMissingBean
    public Scheduler scheduler(SchedulerProperties props, ObjectProvider<ReportSink> sinksProvider) {
        return new EventLoopScheduler(props, new CompositeReportSink(sinksProvider.orderedStream().toList()));
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulerLifecycle schedulerLifecycle(Scheduler scheduler, ObjectProvider<Discovery> discoveryProvider) {
        return new SchedulerLifecycle(scheduler, discoveryProvider.getIfAvailable());
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass({MongoTemplate.class, MongoResultStore.class, ObjectMapper.class})
    @ConditionalOnBean(MongoTemplate.class)
    @ConditionalOnProperty(prefix = "suite4j.report.mongo", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class MongoReportConfig {

        @Bean
        @ConditionalOnMissingBean
        protected MongoResultStore mongoResultStore(MongoTemplate mongoTemplate, ObjectProvider<ObjectMapper> objectMapper) {
            return new MongoResultStore(mongoTemplate, objectMapper.getIfAvailable(ObjectMapper::new));
        }

        @Bean
        @ConditionalOnMissingBean
        protected ResultMongoIndexConfig resultMongoIndexConfig(MongoTemplate mongoTemplate) {
            return new ResultMongoIndexConfig(mongoTemplate);
        }

        @Bean
        @ConditionalOnMissingBean
        public MongoReportSink mongoReportSink(MongoResultStore store, MongoReportProperties props) {
            return new MongoReportSink(store, props.isRecordMethodHistory());
        }

        @Bean
        @ConditionalOnProperty(prefix = "suite4j.report.mongo", name = "ensure-indexes-on-startup", havingValue = "true")
        public SmartInitializingSingleton suiteResultIndexesInitializer(ResultMongoIndexConfig indexConfig) {
            return indexConfig::ensureIndexes;
        }
    }
}
