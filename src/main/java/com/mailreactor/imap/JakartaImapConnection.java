package com.mailreactor.imap;

import jakarta.mail.FetchProfile;
import jakarta.mail.Folder;
import jakarta.mail.FolderNotFoundException;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.UIDFolder;
import jakarta.mail.search.SearchTerm;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.angus.mail.imap.IMAPFolder;
import org.eclipse.angus.mail.imap.IMAPStore;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * {@link ImapConnection} backed by an Angus {@link IMAPStore}.
 * Folders are opened READ_ONLY so listing and fetching never set \Seen.
 */
@Slf4j
public class JakartaImapConnection implements ImapConnection {

    private final IMAPStore store;
    private volatile IMAPFolder folder;

    JakartaImapConnection(IMAPStore store) {
        this.store = store;
    }

    @Override
    public void selectFolder(String name) throws MessagingException {
        IMAPFolder current = folder;
        if (current != null && current.isOpen() && current.getFullName().equals(name)) {
            return;
        }
        closeFolder();
        IMAPFolder candidate = (IMAPFolder) store.getFolder(name);
        if (!candidate.exists()) {
            throw new FolderNotFoundException(candidate, "Folder not found: " + name);
        }
        candidate.open(Folder.READ_ONLY);
        folder = candidate;
    }

    @Override
    public long[] search(SearchTerm term) throws MessagingException {
        IMAPFolder selected = requireFolder();
        Message[] found = term == null ? selected.getMessages() : selected.search(term);
        if (found.length == 0) {
            return new long[0];
        }
        FetchProfile profile = new FetchProfile();
        profile.add(UIDFolder.FetchProfileItem.UID);
        selected.fetch(found, profile);

        long[] uids = new long[found.length];
        for (int i = 0; i < found.length; i++) {
            uids[i] = selected.getUID(found[i]);
        }
        return uids;
    }

    @Override
    public List<Message> fetchSummaries(long[] uids) throws MessagingException {
        IMAPFolder selected = requireFolder();
        Message[] messages = selected.getMessagesByUID(uids);
        Message[] present = Arrays.stream(messages).filter(Objects::nonNull).toArray(Message[]::new);

        FetchProfile profile = new FetchProfile();
        profile.add(FetchProfile.Item.ENVELOPE);
        profile.add(FetchProfile.Item.FLAGS);
        profile.add(FetchProfile.Item.SIZE);
        profile.add(UIDFolder.FetchProfileItem.UID);
        selected.fetch(present, profile);
        return Arrays.asList(messages);
    }

    @Override
    public Message fetchMessage(long uid) throws MessagingException {
        return requireFolder().getMessageByUID(uid);
    }

    @Override
    public long[] uidsAfter(long uid) throws MessagingException {
        IMAPFolder selected = requireFolder();
        // "n:*" always includes the last message, even when its UID is below n
        Message[] candidates = selected.getMessagesByUID(uid + 1, UIDFolder.LASTUID);
        List<Long> uids = new ArrayList<>();
        for (Message message : candidates) {
            long candidate = selected.getUID(message);
            if (candidate > uid) {
                uids.add(candidate);
            }
        }
        return uids.stream().mapToLong(Long::longValue).sorted().toArray();
    }

    @Override
    public long highestUid() throws MessagingException {
        IMAPFolder selected = requireFolder();
        long next = selected.getUIDNext();
        if (next > 0) {
            return next - 1;
        }
        int count = selected.getMessageCount();
        return count == 0 ? 0 : selected.getUID(selected.getMessage(count));
    }

    @Override
    public long uidValidity() throws MessagingException {
        return requireFolder().getUIDValidity();
    }

    @Override
    public List<String> listFolders() throws MessagingException {
        List<String> names = new ArrayList<>();
        for (Folder candidate : store.getDefaultFolder().list("*")) {
            names.add(candidate.getFullName());
        }
        return names;
    }

    @Override
    public boolean isConnected() {
        return store.isConnected();
    }

    @Override
    public void close() {
        closeFolder();
        try {
            store.close();
        } catch (MessagingException e) {
            log.debug("IMAP logout failed: {}", e.getMessage());
        }
    }

    private IMAPFolder requireFolder() throws MessagingException {
        IMAPFolder selected = folder;
        if (selected == null || !selected.isOpen()) {
            throw new MessagingException("No folder selected");
        }
        return selected;
    }

    private void closeFolder() {
        IMAPFolder current = folder;
        folder = null;
        if (current != null && current.isOpen()) {
            try {
                current.close(false);
            } catch (MessagingException e) {
                log.debug("Closing folder {} failed: {}", current.getFullName(), e.getMessage());
            }
        }
    }
}
