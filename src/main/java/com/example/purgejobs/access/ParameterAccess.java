package com.example.purgejobs.access;

import com.example.purgejobs.models.Parameter;
import java.util.Optional;

public interface ParameterAccess {
    Optional<Parameter> find(String name, String configFile);
}
