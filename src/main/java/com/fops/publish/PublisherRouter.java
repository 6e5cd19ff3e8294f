package com.fops.publish;

import java.util.List;

/**
 * Picks the publisher for a repository URL by host substring.
 */
public class PublisherRouter {

    private final List<ProposalPublisher> publishers;

    public PublisherRouter(List<ProposalPublisher> publishers) {
        this.publishers = List.copyOf(publishers);
    }

    /**
     * @throws UnsupportedPlatformException if no publisher handles the URL
     */
    public ProposalPublisher route(String repoUrl) {
        for (ProposalPublisher publisher : publishers) {
            if (publisher.supports(repoUrl)) {
                return publisher;
            }
        }
        throw new UnsupportedPlatformException(repoUrl);
    }

    public List<ProposalPublisher> publishers() {
        return publishers;
    }
}
