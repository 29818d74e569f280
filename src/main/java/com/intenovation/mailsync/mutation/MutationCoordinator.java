package com.intenovation.mailsync.mutation;

import com.intenovation.mailsync.AccountSettings;
import com.intenovation.mailsync.MailSyncChangeEvent;
import com.intenovation.mailsync.MailSyncEvents;
import com.intenovation.mailsync.MailSyncException;
import com.intenovation.mailsync.SyncErrorKind;
import com.intenovation.mailsync.SyncErrors;
import com.intenovation.mailsync.imap.CopyResponse;
import com.intenovation.mailsync.imap.ImapMailbox;
import com.intenovation.mailsync.imap.ImapMailboxFactory;
import com.intenovation.mailsync.imap.SelectedFolder;
import com.intenovation.mailsync.imap.UidRemap;
import com.intenovation.mailsync.imap.UidRemapParser;
import com.intenovation.mailsync.model.MailKey;
import com.intenovation.mailsync.sync.Reconciler;

import javax.mail.Flags;
import javax.mail.MessagingException;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies single-message changes on the server and folds confirmed results
 * into local state.
 * <p>
 * Nothing local changes before the server confirms. A move copies the message,
 * takes the new UID from the COPYUID answer where the server gives one, and then
 * removes the source; a move the server confirms without a UID is reported as
 * {@link MutationState#CONFIRMED_UID_UNKNOWN} and left for the next mirror sync
 * and reconcile to place.
 */
public class MutationCoordinator {
    private static final Logger LOGGER = Logger.getLogger(MutationCoordinator.class.getName());

    private final Reconciler reconciler;
    private final ImapMailboxFactory mailboxFactory;
    private final MailSyncEvents events;

    public MutationCoordinator(Reconciler reconciler, ImapMailboxFactory mailboxFactory, MailSyncEvents events) {
        this.reconciler = reconciler;
        this.mailboxFactory = mailboxFactory;
        this.events = events;
    }

    /**
     * Apply a mutation to one message
     *
     * @param settings The account
     * @param action What to do
     * @param uid The message UID in its folder
     * @param folder The folder holding the message
     * @param target The target folder for {@link MutationAction#MOVE}, otherwise ignored
     * @return The outcome; server and store failures are reported as {@link MutationState#FAILED}
     * @throws InterruptedException If interrupted while waiting for the account lock
     */
    public MutationResult applyMutation(AccountSettings settings, MutationAction action, long uid,
                                        String folder, String target) throws InterruptedException {
        String accountId = settings.getAccountId();
        LOGGER.fine(MutationState.REQUESTED + ": " + action + " UID " + uid + " in " + folder
                + " for account " + accountId);

        MutationResult result;
        if (action.isTargetRequired() && (target == null || target.isEmpty())) {
            result = MutationResult.failed(action, SyncErrorKind.FAILURE, action + " needs a target folder");
        } else if (action == MutationAction.MOVE && folder.equals(target)) {
            result = MutationResult.failed(action, SyncErrorKind.FAILURE, "Message is already in " + target);
        } else {
            result = send(settings, action, uid, folder, target);
        }

        if (result.isSuccess()) {
            LOGGER.info(action + " of UID " + uid + " in " + folder + " confirmed: " + result.getMessage());
            events.fire(MailSyncChangeEvent.ChangeType.MUTATION_CONFIRMED, accountId, result);
        } else {
            LOGGER.warning(action + " of UID " + uid + " in " + folder + " failed: " + result.getMessage());
            events.fire(MailSyncChangeEvent.ChangeType.MUTATION_FAILED, accountId, result);
        }
        return result;
    }

    private MutationResult send(AccountSettings settings, MutationAction action, long uid, String folder,
                                String target) throws InterruptedException {
        MailKey source;
        MutationResult result;
        try (ImapMailbox mailbox = mailboxFactory.open(settings)) {
            String destination = target;
            if (action == MutationAction.MOVE_TO_TRASH) {
                Optional<String> trash = mailbox.findTrashFolder();
                if (!trash.isPresent()) {
                    return MutationResult.failed(action, SyncErrorKind.PROTOCOL_CAPABILITY_MISSING,
                            "Server announces no \\Trash folder");
                }
                destination = trash.get();
                if (destination.equals(folder)) {
                    return MutationResult.failed(action, SyncErrorKind.FAILURE, "Message is already in " + folder);
                }
            }

            SelectedFolder selected = mailbox.select(folder, false);
            source = new MailKey(settings.getAccountId(), folder, selected.getUidValidity(), uid);
            LOGGER.fine(MutationState.SENT_TO_SERVER + ": " + action + " " + source);

            if (action.isMove()) {
                result = move(mailbox, action, source, destination);
            } else if (action.isFlagChange()) {
                result = changeFlag(mailbox, action, source);
            } else {
                result = delete(mailbox, action, source);
            }
        } catch (MessagingException e) {
            LOGGER.log(Level.WARNING, action + " of UID " + uid + " in " + folder + " was not confirmed", e);
            return MutationResult.failed(action, SyncErrors.classify(e), e.getMessage());
        }

        foldIntoLocalState(action, source, result);
        return result;
    }

    private MutationResult move(ImapMailbox mailbox, MutationAction action, MailKey source, String destination)
            throws MessagingException {
        CopyResponse response = mailbox.copy(source.getUid(), destination);
        Optional<UidRemap> remap = response.getRemap();
        if (!remap.isPresent() && response.getRawResponse().isPresent()) {
            remap = UidRemapParser.parse(response.getRawResponse().get(), source.getUid());
        }

        try {
            mailbox.addFlags(source.getUid(), new Flags(Flags.Flag.DELETED));
            mailbox.expunge();
        } catch (MessagingException e) {
            // the copy exists, the source goes away with the next expunge
            LOGGER.log(Level.WARNING, "Could not remove " + source + " after copying it to " + destination, e);
        }

        if (remap.isPresent()) {
            return MutationResult.moved(action, destination, remap.get().getUidValidity(),
                    remap.get().getTargetUid());
        }
        return MutationResult.movedUidUnknown(action, destination);
    }

    private MutationResult delete(ImapMailbox mailbox, MutationAction action, MailKey source)
            throws MessagingException {
        if (!mailbox.addFlags(source.getUid(), new Flags(Flags.Flag.DELETED))) {
            return MutationResult.noop(action, "UID " + source.getUid() + " no longer on the server");
        }
        mailbox.expunge();
        return MutationResult.confirmed(action, null, "Deleted");
    }

    private MutationResult changeFlag(ImapMailbox mailbox, MutationAction action, MailKey source)
            throws MessagingException {
        Flags flags = new Flags(action.getFlag());
        boolean present = action.getFlagValue()
                ? mailbox.addFlags(source.getUid(), flags)
                : mailbox.removeFlags(source.getUid(), flags);
        if (!present) {
            return MutationResult.failed(action, SyncErrorKind.FAILURE,
                    "UID " + source.getUid() + " not found in " + source.getFolder());
        }
        return MutationResult.confirmed(action, source.getFolder(), action.getDescription());
    }

    /**
     * The server already changed; a failure here only delays the local view until the next reconcile
     */
    private void foldIntoLocalState(MutationAction action, MailKey source, MutationResult result)
            throws InterruptedException {
        if (!result.isSuccess() || result.isNoop()) {
            return;
        }
        try {
            if (action.isMove()) {
                reconciler.applyConfirmedMove(source, result.getNewFolder(), result.getNewUidValidity(),
                        result.getNewUid());
            } else if (action.isFlagChange()) {
                Boolean value = action.getFlagValue();
                if (action.getFlag() == Flags.Flag.SEEN) {
                    reconciler.applyConfirmedFlags(source, value, null);
                } else {
                    reconciler.applyConfirmedFlags(source, null, value);
                }
            } else {
                reconciler.applyConfirmedDelete(source);
            }
        } catch (MailSyncException e) {
            LOGGER.log(Level.WARNING, "Confirmed " + action + " of " + source
                    + " not yet reflected locally, the next reconcile picks it up", e);
        }
    }
}
