package com.mailreactor.domain;

import lombok.Value;

/**
 * Position in a folder: the highest UID seen, valid only while the folder keeps the same UIDVALIDITY
 */
@Value
public class FolderCursor {

    String folder;
    long uidValidity;
    long uid;

    public FolderCursor advanceTo(long seenUid) {
        return seenUid > uid ? new FolderCursor(folder, uidValidity, seenUid) : this;
    }

    public boolean sameEpoch(FolderCursor other) {
        return other != null && folder.equals(other.folder) && uidValidity == other.uidValidity;
    }
}
