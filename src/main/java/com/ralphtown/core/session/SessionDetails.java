package com.ralphtown.core.session;

import com.ralphtown.core.model.Message;
import com.ralphtown.core.model.Session;

import java.util.List;

/**
 * A session together with its conversation.
 */
public record SessionDetails(
    Session session,
    List<Message> messages
) {}
