package dk.trustworks.payroll.aggregates.insurance.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Social insurance scheme (pension, medical, unemployment, housing fund ...). Reference data.
 */
@Entity
@Table(name = "insurance_types")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class InsuranceType {

    @Id
    @Column(length = 36)
    private String uuid;

    @Column(name = "type_key", nullable = false, unique = true, length = 50)
    private String key;

    @Column(nullable = false, length = 100)
    private String name;

    @Builder.Default
    private boolean active = true;

    /**
     * A mandatory type has to be part of every proposed base set it applies to.
     */
    private boolean mandatory;
}
