package com.example.datadestruction.access;

import com.example.datadestruction.models.Participant;
import java.util.List;

public interface ParticipantAccess {

    /**
     * Finds registry entries whose "destroy data" and "data has been destroyed" flags are both
     * set. Entries with only one of the flags are not returned.
     */
    List<Participant> findConfirmedDestructions();
}
