package automata.email.app.engine;

/**
 * Runs one mailbox call or lookup and turns any failure into a {@link MailboxCallException}
 * naming the step and group it belonged to.
 */
final class MailboxCalls {

    @FunctionalInterface
    interface MailboxCall {
        void execute() throws Exception;
    }

    @FunctionalInterface
    interface MailboxQuery<T> {
        T execute() throws Exception;
    }

    private MailboxCalls() {
    }

    static void invoke(DispatchStep step, String groupKey, int groupSize, MailboxCall call) {
        fetch(step, groupKey, groupSize, () -> {
            call.execute();
            return null;
        });
    }

    static <T> T fetch(DispatchStep step, String groupKey, int groupSize, MailboxQuery<T> query) {
        try {
            return query.execute();
        } catch (MailboxCallException | MalformedActionException e) {
            throw e;
        } catch (Exception e) {
            throw new MailboxCallException(step, groupKey, groupSize, e);
        }
    }
}
