package slackauth.domain.auth;

public final class ClaimTypes {
    public static final String NAME_IDENTIFIER = "http://schemas.xmlsoap.org/ws/2005/05/identity/claims/nameidentifier";
    public static final String NAME = "http://schemas.xmlsoap.org/ws/2005/05/identity/claims/name";
    public static final String ROLE = "http://schemas.microsoft.com/ws/2008/06/identity/claims/role";
    public static final String SLACK_TEAM_ID = "urn:slack:teamid";
    public static final String SLACK_TEAM_NAME = "urn:slack:teamname";
    public static final String XML_SCHEMA_STRING = "http://www.w3.org/2001/XMLSchema#string";

    private ClaimTypes() {
    }
}
