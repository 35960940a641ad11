package io.kubecache.guava;

import java.lang.reflect.AnnotatedElement;

import com.google.common.eventbus.DeadEvent;
import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.Subscribe;
import com.google.common.eventbus.SubscriberExceptionContext;
import com.google.inject.AbstractModule;
import com.google.inject.Binding;
import com.google.inject.matcher.AbstractMatcher;
import com.google.inject.matcher.Matcher;
import com.google.inject.matcher.Matchers;
import com.google.inject.spi.ProvisionListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class EventBusModule extends AbstractModule {
    private static final Logger logger = LoggerFactory.getLogger(EventBusModule.class);

    private static final Matcher<AnnotatedElement> EVENT_BUS_SUBSCRIBER_MATCHER = Matchers.annotatedWith(EventBusSubscriber.class);

    private final EventBus eventBus = new EventBus(EventBusModule::logSubscriberException);

    public EventBusModule() {
        eventBus.register(new Object() {
            @Subscribe
            void handleDeadEvent(final DeadEvent event) {
                logger.trace("{} was posted to the bus and nobody cared.", event.getEvent());
            }
        });
    }

    // a failing subscriber must never affect the poster, so the failure only gets logged
    static void logSubscriberException(final Throwable exception, final SubscriberExceptionContext context) {
        logger.error("Subscriber {}.{} failed to handle {}.",
                     context.getSubscriber().getClass().getSimpleName(),
                     context.getSubscriberMethod().getName(),
                     context.getEvent(),
                     exception);
    }

    @Override
    protected void configure() {
        bind(EventBus.class).toInstance(eventBus);

        // register all provisioned EventBusSubscribers with the EventBus
        bindListener(new AbstractMatcher<Binding<?>>() {
            @Override
            public boolean matches(final Binding<?> binding) {
                return EVENT_BUS_SUBSCRIBER_MATCHER.matches(binding.getKey().getTypeLiteral().getRawType());
            }
        }, new ProvisionListener() {
            @Override
            public <T> void onProvision(final ProvisionInvocation<T> provision) {
                eventBus.register(provision.provision());
            }
        });
    }
}
