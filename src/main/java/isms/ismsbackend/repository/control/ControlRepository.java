package isms.ismsbackend.repository.control;

import isms.ismsbackend.entity.control.Control;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ControlRepository extends JpaRepository<Control, String> {
}
