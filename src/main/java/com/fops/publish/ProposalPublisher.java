package com.fops.publish;

import com.fops.core.error.MissingCredentialException;

import java.util.Map;

/**
 * Publishes a proposal on one hosted git platform: branch, file commits and a
 * pull/merge request, followed by an optional report comment.
 */
public interface ProposalPublisher {

    /** Platform key used in audit entries and metrics, e.g. {@code github}. */
    String platform();

    boolean supports(String repoUrl);

    /**
     * @throws MissingCredentialException if no API token is configured
     */
    void checkCredentials();

    /**
     * Creates the branch from the base tip (reusing it if it already exists),
     * writes every file (update when present, create on not-found) and opens the
     * pull/merge request.
     *
     * @return web URL of the new pull/merge request
     * @throws InvalidRepoUrlException if {@code repoUrl} does not match the platform's pattern
     * @throws PlatformApiException    on any other API failure
     */
    String publish(PublishRequest request);

    /**
     * Posts {@code artifacts} as one comment on the proposal.
     *
     * @return false when there was nothing to attach
     * @throws InvalidRepoUrlException if {@code proposalUrl} is not a PR/MR URL of this platform
     * @throws PlatformApiException    if the comment could not be posted
     */
    boolean attach(String proposalUrl, Map<String, Object> artifacts);
}
