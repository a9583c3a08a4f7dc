package com.whereq.launcher.model;

import lombok.Value;

import java.util.List;

/**
 * A descriptor together with the spark-submit arguments rendered from it
 */
@Value
public class SubmitInvocation {

    JobDescriptor descriptor;

    /**
     * spark-submit arguments, without the executable
     */
    List<String> arguments;
}
