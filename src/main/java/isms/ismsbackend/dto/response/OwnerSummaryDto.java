package isms.ismsbackend.dto.response;

import isms.ismsbackend.entity.UserEntity;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class OwnerSummaryDto {
    private String id;
    private String displayName;
    private String email;

    public static OwnerSummaryDto from(UserEntity user) {
        return new OwnerSummaryDto(user.getId(), user.getDisplayName(), user.getEmail());
    }
}
