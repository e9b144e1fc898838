package guraa.xmlcompare.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AuthCredentials {
    private String username;

    @ToString.Exclude
    private String password;
}
