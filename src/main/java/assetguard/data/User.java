package assetguard.data;

public class User {
    private String id;
    private String name;
    private UserRole role = UserRole.STAFF;
    private String email;
    private String department;
    private String password;

    public User() {
    }

    public User(String id, String name, UserRole role, String email, String department) {
        this.id = id;
        this.name = name;
        this.role = role;
        this.email = email;
        this.department = department;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public UserRole getRole() {
        return role;
    }

    public void setRole(UserRole role) {
        this.role = role;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getDepartment() {
        return department;
    }

    public void setDepartment(String department) {
        this.department = department;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    @Override
    public String toString() {
        return "User{id='" + id + "', name='" + name + "', role=" + role + "}";
    }
}
