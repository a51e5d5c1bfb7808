package com.example.udahub.pipeline;

import com.example.udahub.model.TicketSession;
import com.example.udahub.routing.StageName;

/**
 * One step of ticket handling. A stage commits everything it changes through a single
 * {@link com.example.udahub.repository.SessionStore#commit} before returning, never invokes another
 * stage, and may be re-run on the same session and message.
 */
public interface Stage {

    StageName name();

    /**
     * @throws com.example.udahub.failure.CollaboratorFailureException when a collaborator fails; nothing has been committed
     */
    StageResult run(TicketSession session, String incomingMessage);
}
