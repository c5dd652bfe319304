package assetguard.data;

public enum UserRole {
    ADMIN("Admin"),
    STAFF("Staff"),
    VIEWER("Viewer"),
    OPERATOR("Operator");

    private final String label;

    UserRole(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static UserRole fromLabel(String label) {
        for (UserRole role : values()) {
            if (role.label.equalsIgnoreCase(label.trim())) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown user role: " + label);
    }

    @Override
    public String toString() {
        return label;
    }
}
