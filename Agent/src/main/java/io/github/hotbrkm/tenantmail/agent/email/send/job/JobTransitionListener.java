package io.github.hotbrkm.tenantmail.agent.email.send.job;

@FunctionalInterface
public interface JobTransitionListener {

    void onTransition(JobTransitionEvent event);
}
