package tech.flowcatalyst.directory.odata;

import java.util.regex.Pattern;

/**
 * Error texts the directory uses for conditions the client reacts to.
 */
public final class ODataErrors {

    public static final Pattern ADDED_OBJECT_REFERENCES_ALREADY_EXIST =
        Pattern.compile("One or more added object references already exist");

    public static final Pattern REMOVED_OBJECT_REFERENCES_DO_NOT_EXIST =
        Pattern.compile("One or more removed object references do not exist");

    public static final Pattern RESOURCE_DOES_NOT_EXIST =
        Pattern.compile("Resource '.+' does not exist or one of its queried reference-property objects are not present");

    public static final Pattern CANNOT_DELETE_OR_UPDATE_ENABLED_ENTITLEMENT =
        Pattern.compile("Permission \\(scope or role\\) cannot be deleted or updated unless disabled first");

    private ODataErrors() {
    }
}
