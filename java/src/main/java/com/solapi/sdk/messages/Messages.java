package com.solapi.sdk.messages;

import com.solapi.sdk.Config;
import com.solapi.sdk.SignedRequestClient;
import com.solapi.sdk.SolapiException;

import java.util.Map;
import java.util.Objects;

/**
 * SOLAPI messaging resource.
 */
public final class Messages {

    static final String SEND_PATH = "messages/v4/send";
    static final String LIST_PATH = "messages/v4/list";

    private final SignedRequestClient requests;
    private final Agent agent;

    public Messages(SignedRequestClient requests) {
        this.requests = Objects.requireNonNull(requests, "requests");
        Config config = requests.getConfig();
        this.agent = new Agent(config.getSdkVersion(), config.getOsPlatform(), config.getAppId());
    }

    /**
     * Sends one message. The SDK identifies itself through the {@code agent} block, which also carries the configured
     * app id.
     */
    public SendResult sendSimpleMessage(Message message) throws SolapiException {
        Objects.requireNonNull(message, "message");
        return requests.post(SEND_PATH, new SendBody(message, agent), SendResult.class);
    }

    /**
     * @param params filters such as {@code messageId}, {@code groupId}, {@code to}, {@code startKey} and {@code limit}.
     */
    public MessageList getMessageList(Map<String, String> params) throws SolapiException {
        return requests.get(LIST_PATH, params, MessageList.class);
    }

    private record Agent(String sdkVersion, String osPlatform, String appId) {
    }

    private record SendBody(Message message, Agent agent) {
    }
}
