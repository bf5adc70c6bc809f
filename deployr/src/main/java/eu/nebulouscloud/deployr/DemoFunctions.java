package eu.nebulouscloud.deployr;

import eu.nebulouscloud.deployr.channel.ChannelEndpoint;
import eu.nebulouscloud.deployr.channel.ChannelToken;
import eu.nebulouscloud.deployr.model.Channel;
import eu.nebulouscloud.deployr.model.Instance;
import lombok.extern.slf4j.Slf4j;

/**
 * Functions for trying out deployments from the command line.
 *
 * <ul><li>{@value #COORDINATOR}: greet the consumer of every channel the
 * instance produces into.
 *
 * <li>{@value #WORKER}: wait for the greeting on the channel named
 * {@code "Coordinator -> <instance name>"}, if the request has one, and
 * print it.
 * </ul>
 */
@Slf4j
public final class DemoFunctions {

    public static final String COORDINATOR = "Coordinator";
    public static final String WORKER = "Worker";

    private DemoFunctions() { }

    public static void registerAll(FunctionRegistry registry) {
        registry.register(COORDINATOR, DemoFunctions::coordinator);
        registry.register(WORKER, DemoFunctions::worker);
    }

    static void coordinator(DeployR deployr) {
        Instance self = deployr.getLocalInstance().orElseThrow();
        System.out.println("Instance '" + self.getName() + "' running on host " + deployr.getBackend().getLocalHostIndex());
        for (Channel channel : deployr.getDeployment().getRequest().getChannels()) {
            if (!channel.getProducers().contains(self.getName())) continue;
            String greeting = "Hello " + channel.getConsumer() + "!";
            if (!deployr.getChannel(channel.getName()).push(greeting)) {
                log.warn("Could not send greeting on channel '{}'", channel.getName());
            }
        }
    }

    static void worker(DeployR deployr) {
        Instance self = deployr.getLocalInstance().orElseThrow();
        System.out.println("Instance '" + self.getName() + "' running on host " + deployr.getBackend().getLocalHostIndex());
        String channelName = COORDINATOR + " -> " + self.getName();
        if (!deployr.hasChannel(channelName)) return;
        ChannelEndpoint channel = deployr.getChannel(channelName);
        ChannelToken token = channel.peek();
        while (!token.isSuccess()) {
            Thread.onSpinWait();
            token = channel.peek();
        }
        System.out.println("Instance '" + self.getName() + "' received: " + token.getString());
        channel.pop();
    }
}
