package com.intenovation.mailsync.imap;

import com.intenovation.mailsync.ProtocolCapabilityMissingException;
import com.intenovation.mailsync.model.EnvelopeExtractor;
import com.intenovation.mailsync.model.MailFlags;
import com.sun.mail.iap.Argument;
import com.sun.mail.iap.ProtocolException;
import com.sun.mail.iap.Response;
import com.sun.mail.imap.AppendUID;
import com.sun.mail.imap.IMAPFolder;
import com.sun.mail.imap.IMAPStore;
import com.sun.mail.imap.protocol.BASE64MailboxEncoder;

import javax.mail.FetchProfile;
import javax.mail.Flags;
import javax.mail.Folder;
import javax.mail.Message;
import javax.mail.MessagingException;
import javax.mail.UIDFolder;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link ImapMailbox} over a connected JavaMail {@link IMAPStore}.
 * <p>
 * COPY uses {@link IMAPFolder#copyUIDMessages} when the server advertises
 * UIDPLUS. Without it the command is issued directly so that a COPYUID code the
 * server sends anyway can still be read from the raw response.
 */
public class JavaMailImapMailbox implements ImapMailbox {
    private static final Logger LOGGER = Logger.getLogger(JavaMailImapMailbox.class.getName());

    private static final String TRASH_ATTRIBUTE = "\\Trash";

    private final IMAPStore store;
    private IMAPFolder selected;

    public JavaMailImapMailbox(IMAPStore store) {
        this.store = store;
    }

    @Override
    public List<String> listFolders() throws MessagingException {
        List<String> names = new ArrayList<>();
        for (Folder folder : store.getDefaultFolder().list("*")) {
            if ((folder.getType() & Folder.HOLDS_MESSAGES) != 0) {
                names.add(folder.getFullName());
            }
        }
        return names;
    }

    @Override
    public SelectedFolder select(String folderName, boolean readOnly) throws MessagingException {
        closeSelected();
        IMAPFolder folder = (IMAPFolder) store.getFolder(folderName);
        if (!folder.exists()) {
            throw new MessagingException("Folder does not exist: " + folderName);
        }
        folder.open(readOnly ? Folder.READ_ONLY : Folder.READ_WRITE);
        selected = folder;
        LOGGER.fine("Selected " + folderName + (readOnly ? " read-only" : " read-write"));
        return new SelectedFolder(folderName, folder.getUIDValidity());
    }

    @Override
    public long[] searchAll() throws MessagingException {
        IMAPFolder folder = requireSelected();
        Message[] messages = folder.getMessagesByUID(1, UIDFolder.LASTUID);
        FetchProfile fp = new FetchProfile();
        fp.add(UIDFolder.FetchProfileItem.UID);
        folder.fetch(messages, fp);

        long[] uids = new long[messages.length];
        int count = 0;
        for (Message message : messages) {
            if (message != null && !message.isExpunged()) {
                uids[count++] = folder.getUID(message);
            }
        }
        long[] result = Arrays.copyOf(uids, count);
        Arrays.sort(result);
        return result;
    }

    @Override
    public List<FetchedEnvelope> fetchEnvelopes(long[] uids) throws MessagingException {
        IMAPFolder folder = requireSelected();
        List<Message> present = new ArrayList<>();
        for (Message message : folder.getMessagesByUID(uids)) {
            if (message != null) {
                present.add(message);
            }
        }
        Message[] messages = present.toArray(new Message[0]);

        FetchProfile fp = new FetchProfile();
        fp.add(FetchProfile.Item.ENVELOPE);
        fp.add(FetchProfile.Item.FLAGS);
        fp.add(UIDFolder.FetchProfileItem.UID);
        folder.fetch(messages, fp);

        List<FetchedEnvelope> result = new ArrayList<>(messages.length);
        for (Message message : messages) {
            long uid = folder.getUID(message);
            try {
                result.add(new FetchedEnvelope(uid, EnvelopeExtractor.extract(message),
                        MailFlags.toFlagString(message.getFlags())));
            } catch (MessagingException e) {
                // the message was expunged between search and fetch
                LOGGER.log(Level.FINE, "Skipping UID " + uid + " in " + folder.getFullName(), e);
            }
        }
        return result;
    }

    @Override
    public Optional<byte[]> fetchRawMessage(long uid) throws MessagingException {
        IMAPFolder folder = requireSelected();
        Message message = folder.getMessageByUID(uid);
        if (message == null) {
            return Optional.empty();
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            message.writeTo(out);
        } catch (IOException e) {
            throw new MessagingException("Error reading UID " + uid + " from " + folder.getFullName(), e);
        }
        return Optional.of(out.toByteArray());
    }

    @Override
    public CopyResponse copy(long uid, String targetFolder) throws MessagingException {
        IMAPFolder folder = requireSelected();
        Message message = folder.getMessageByUID(uid);
        if (message == null) {
            throw new MessagingException("UID " + uid + " not found in " + folder.getFullName());
        }

        if (store.hasCapability("UIDPLUS")) {
            AppendUID[] result = folder.copyUIDMessages(new Message[]{message}, store.getFolder(targetFolder));
            if (result != null && result.length > 0 && result[0] != null) {
                return CopyResponse.structured(new UidRemap(result[0].uidvalidity, uid, result[0].uid));
            }
            return CopyResponse.empty();
        }

        LOGGER.fine("UIDPLUS not advertised, issuing UID COPY directly");
        final String mailbox = BASE64MailboxEncoder.encode(targetFolder);
        String raw = (String) folder.doCommand(p -> {
            Argument args = new Argument();
            args.writeAtom(String.valueOf(uid));
            args.writeString(mailbox);
            Response[] r = p.command("UID COPY", args);
            Response response = r[r.length - 1];
            String text = responseText(r, null);
            p.notifyResponseHandlers(r);
            p.handleResult(response);
            return text;
        });
        return CopyResponse.raw(raw);
    }

    @Override
    public boolean addFlags(long uid, Flags flags) throws MessagingException {
        return setFlags(uid, flags, true);
    }

    @Override
    public boolean removeFlags(long uid, Flags flags) throws MessagingException {
        return setFlags(uid, flags, false);
    }

    private boolean setFlags(long uid, Flags flags, boolean value) throws MessagingException {
        IMAPFolder folder = requireSelected();
        Message message = folder.getMessageByUID(uid);
        if (message == null) {
            return false;
        }
        folder.setFlags(new Message[]{message}, flags, value);
        return true;
    }

    @Override
    public void expunge() throws MessagingException {
        requireSelected().expunge();
    }

    @Override
    public boolean supportsThreading(String algorithm) throws MessagingException {
        return store.hasCapability("THREAD=" + algorithm.toUpperCase(Locale.ROOT));
    }

    @Override
    public String thread(String algorithm) throws MessagingException {
        IMAPFolder folder = requireSelected();
        final String upper = algorithm.toUpperCase(Locale.ROOT);
        if (!supportsThreading(upper)) {
            throw new ProtocolCapabilityMissingException("THREAD=" + upper);
        }
        return (String) folder.doCommand(p -> {
            Argument args = new Argument();
            args.writeAtom(upper);
            args.writeAtom("UTF-8");
            args.writeAtom("ALL");
            Response[] r = p.command("UID THREAD", args);
            Response response = r[r.length - 1];
            if (!response.isOK()) {
                throw new ProtocolException("THREAD failed: " + response);
            }
            String text = responseText(r, "THREAD");
            p.notifyResponseHandlers(r);
            p.handleResult(response);
            return text;
        });
    }

    @Override
    public Optional<String> findTrashFolder() throws MessagingException {
        for (Folder folder : store.getDefaultFolder().list("*")) {
            if (folder instanceof IMAPFolder) {
                for (String attribute : ((IMAPFolder) folder).getAttributes()) {
                    if (TRASH_ATTRIBUTE.equalsIgnoreCase(attribute)) {
                        return Optional.of(folder.getFullName());
                    }
                }
            }
        }
        return Optional.empty();
    }

    @Override
    public void close() throws MessagingException {
        try {
            closeSelected();
        } finally {
            store.close();
        }
    }

    private void closeSelected() {
        if (selected != null && selected.isOpen()) {
            try {
                selected.close(false);
            } catch (MessagingException e) {
                LOGGER.log(Level.WARNING, "Error closing folder " + selected.getFullName(), e);
            }
        }
        selected = null;
    }

    private IMAPFolder requireSelected() throws MessagingException {
        if (selected == null || !selected.isOpen()) {
            throw new MessagingException("No folder selected");
        }
        return selected;
    }

    /**
     * Join the response lines, optionally only the untagged ones containing a keyword
     */
    private static String responseText(Response[] responses, String keyword) {
        StringBuilder sb = new StringBuilder();
        for (Response response : responses) {
            if (response == null) {
                continue;
            }
            String line = response.toString();
            if (keyword == null
                    || (response.isUnTagged() && line.toUpperCase(Locale.ROOT).contains(keyword))) {
                sb.append(line).append('\n');
            }
        }
        return sb.toString();
    }
}
