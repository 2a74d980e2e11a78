package com.example.purgejobs.access;

import com.example.purgejobs.models.Server;
import java.util.List;

public interface ServerAccess {
    List<Server> findAllByCdnId(long cdnId);
}
