package com.khaounen.registrationpolicy.security.policy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.khaounen.registrationpolicy.security.filters.RegistrationPolicyFilter;
import com.khaounen.registrationpolicy.security.policy.reputation.LocalReputationTracker;
import com.khaounen.registrationpolicy.security.policy.reputation.RedisReputationTracker;
import com.khaounen.registrationpolicy.security.policy.reputation.ReputationTracker;
import com.khaounen.registrationpolicy.security.policy.rules.ClientNameLengthRule;
import com.khaounen.registrationpolicy.security.policy.rules.ClientUriRule;
import com.khaounen.registrationpolicy.security.policy.rules.ContactsRule;
import com.khaounen.registrationpolicy.security.policy.rules.RedirectUriRule;
import com.khaounen.registrationpolicy.security.policy.rules.RequesterRateLimitRule;
import com.khaounen.registrationpolicy.security.policy.rules.UserAgentPatternRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.mail.javamail.JavaMailSender;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@AutoConfiguration
@ConditionalOnProperty(prefix = "registration-policy", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties({RegistrationPolicyProperties.class, PolicyAuditProperties.class})
public class RegistrationPolicyAutoConfiguration {

    /**
     * The rule set in its fixed evaluation order. Disabled rules are left out.
     */
    public static List<Rule> defaultRules(RegistrationPolicyProperties properties) {
        RegistrationPolicyProperties.Rules config = properties.getRules();
        List<Rule> rules = new ArrayList<>();

        RegistrationPolicyProperties.RedirectUris redirectUris = config.getRedirectUris();
        if (redirectUris.isEnabled()) {
            rules.add(new RedirectUriRule(
                    redirectUris.getAllowedCustomSchemes(),
                    redirectUris.isAllowLoopbackHttp(),
                    redirectUris.isFatal()
            ));
        }
        RegistrationPolicyProperties.ClientUri clientUri = config.getClientUri();
        if (clientUri.isEnabled()) {
            rules.add(new ClientUriRule(clientUri.isAllowMissing(), clientUri.isFatal()));
        }
        RegistrationPolicyProperties.ClientName clientName = config.getClientName();
        if (clientName.isEnabled()) {
            rules.add(new ClientNameLengthRule(clientName.getMaxLength(), clientName.isFatal()));
        }
        RegistrationPolicyProperties.Contacts contacts = config.getContacts();
        if (contacts.isEnabled()) {
            rules.add(new ContactsRule(contacts.isFatal()));
        }
        RegistrationPolicyProperties.UserAgent userAgent = config.getUserAgent();
        if (userAgent.isEnabled()) {
            rules.add(new UserAgentPatternRule(
                    userAgent.getPatterns(),
                    userAgent.getAction(),
                    userAgent.isFatal(),
                    userAgent.isFlagMissing()
            ));
        }
        RegistrationPolicyProperties.RateLimit rateLimit = config.getRateLimit();
        if (rateLimit.isEnabled()) {
            rules.add(new RequesterRateLimitRule(
                    rateLimit.getMaxRequests(),
                    Duration.ofSeconds(Math.max(1, rateLimit.getWindowSeconds())),
                    rateLimit.getKeyType(),
                    rateLimit.isFatal()
            ));
        }
        return List.copyOf(rules);
    }

    static LocalReputationTracker localTracker(RegistrationPolicyProperties properties) {
        int sweepSeconds = properties.getReputation().getSweepIntervalSeconds();
        Duration sweepInterval = sweepSeconds > 0 ? Duration.ofSeconds(sweepSeconds) : null;
        return new LocalReputationTracker(sweepInterval, Clock.systemUTC());
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(RedisTemplate.class)
    @ConditionalOnProperty(prefix = "registration-policy.reputation", name = "store", havingValue = "redis")
    static class RedisReputationConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public ReputationTracker redisReputationTracker(
                RegistrationPolicyProperties properties,
                ObjectProvider<RedisTemplate<String, Long>> redisTemplateProvider
        ) {
            RedisTemplate<String, Long> redis = redisTemplateProvider.getIfAvailable();
            if (redis == null) {
                log.warn("registration-policy.reputation.store=redis but no RedisTemplate<String, Long> is available, using the local tracker");
                return localTracker(properties);
            }
            RegistrationPolicyProperties.Reputation reputation = properties.getReputation();
            return new RedisReputationTracker(
                    redis,
                    reputation.getKeyPrefix(),
                    Duration.ofMillis(reputation.getTimeoutMs()),
                    reputation.getMaxConcurrentCalls()
            );
        }
    }

    @Bean
    @ConditionalOnMissingBean
    public ReputationTracker reputationTracker(RegistrationPolicyProperties properties) {
        return localTracker(properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public PolicyInputNormalizer policyInputNormalizer(ObjectProvider<ObjectMapper> objectMapperProvider) {
        return new PolicyInputNormalizer(objectMapperProvider.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public PolicyDecisionListener policyDecisionListener(
            PolicyAuditProperties properties,
            ObjectProvider<ObjectMapper> objectMapperProvider,
            ObjectProvider<JavaMailSender> mailSenderProvider
    ) {
        return new PolicyAuditDispatcher(properties, objectMapperProvider.getIfAvailable(ObjectMapper::new), mailSenderProvider);
    }

    @Bean
    @ConditionalOnMissingBean
    public RegistrationPolicyEngine registrationPolicyEngine(
            RegistrationPolicyProperties properties,
            ReputationTracker reputationTracker,
            PolicyInputNormalizer normalizer,
            PolicyDecisionListener listener,
            ObjectProvider<Clock> clockProvider
    ) {
        List<Rule> rules = defaultRules(properties);
        log.info("registration policy enabled with rules {} ({})",
                rules.stream().map(Rule::id).toList(), properties.getFailureMode());
        return new RegistrationPolicyEngine(
                rules,
                reputationTracker,
                properties.getFailureMode(),
                clockProvider.getIfUnique(Clock::systemUTC),
                normalizer,
                listener
        );
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    @ConditionalOnProperty(prefix = "registration-policy.filter", name = "enabled", havingValue = "true")
    static class RegistrationPolicyFilterConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public RegistrationPolicyFilter registrationPolicyFilter(
                RegistrationPolicyProperties properties,
                RegistrationPolicyEngine engine,
                ObjectProvider<ObjectMapper> objectMapperProvider
        ) {
            return new RegistrationPolicyFilter(properties, engine, objectMapperProvider.getIfAvailable(ObjectMapper::new));
        }
    }
}
